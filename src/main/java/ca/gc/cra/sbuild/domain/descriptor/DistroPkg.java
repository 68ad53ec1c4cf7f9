package ca.gc.cra.sbuild.domain.descriptor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Per-distribution package name overrides ({@code distro_pkg}).
 * <p>A node is either a list of package names or an inner mapping whose children are again
 * {@code DistroPkg} nodes, e.g. {@code distro -> release -> packages}. Inner nodes keep repeated keys so
 * duplicate paths can be reported.</p>
 *
 * @since 0.1.0
 */
public sealed interface DistroPkg permits DistroPkg.PackageList, DistroPkg.InnerNode {

  /**
   * Parses a raw YAML value into the override tree.
   *
   * @param raw value produced by the YAML parser
   * @return parsed tree, or empty when the value is neither a list of strings nor a mapping of such nodes
   */
  static Optional<DistroPkg> parse(Object raw) {
    if (raw instanceof List<?> list) {
      List<String> packages = new ArrayList<>(list.size());
      for (Object item : list) {
        if (!(item instanceof String name)) {
          return Optional.empty();
        }
        packages.add(name);
      }
      return Optional.of(new PackageList(packages));
    }
    if (raw instanceof RawMapping mapping) {
      List<Child> children = new ArrayList<>(mapping.size());
      for (RawMapping.Entry entry : mapping.entries()) {
        Optional<DistroPkg> child = parse(entry.value());
        if (child.isEmpty()) {
          return Optional.empty();
        }
        children.add(new Child(entry.key(), child.get()));
      }
      return Optional.of(new InnerNode(children));
    }
    return Optional.empty();
  }

  /**
   * Converts the tree to plain collections for serialization; the first child wins for repeated keys.
   *
   * @return list of names or ordered map
   */
  Object toPlain();

  /**
   * Leaf holding package names.
   *
   * @param packages package names in source order
   */
  record PackageList(List<String> packages) implements DistroPkg {
    /**
     * Copies the package list.
     */
    public PackageList {
      packages = List.copyOf(Objects.requireNonNull(packages, "packages"));
    }

    @Override
    public Object toPlain() {
      return new ArrayList<>(packages);
    }
  }

  /**
   * Inner mapping node.
   *
   * @param children child entries in source order, repeated keys preserved
   */
  record InnerNode(List<Child> children) implements DistroPkg {
    /**
     * Copies the children.
     */
    public InnerNode {
      children = List.copyOf(Objects.requireNonNull(children, "children"));
    }

    @Override
    public Object toPlain() {
      Map<String, Object> plain = new LinkedHashMap<>();
      for (Child child : children) {
        plain.putIfAbsent(child.key(), child.value().toPlain());
      }
      return plain;
    }
  }

  /**
   * Keyed child of an {@link InnerNode}.
   *
   * @param key mapping key
   * @param value child node
   */
  record Child(String key, DistroPkg value) {
    /**
     * Validates components.
     */
    public Child {
      Objects.requireNonNull(key, "key");
      Objects.requireNonNull(value, "value");
    }
  }
}
