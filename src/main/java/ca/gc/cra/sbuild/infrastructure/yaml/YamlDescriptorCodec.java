package ca.gc.cra.sbuild.infrastructure.yaml;

import ca.gc.cra.sbuild.application.port.DescriptorCodec;
import ca.gc.cra.sbuild.application.port.DescriptorFormatException;
import ca.gc.cra.sbuild.domain.descriptor.BuildDescriptor;
import ca.gc.cra.sbuild.domain.descriptor.RawDocument;
import ca.gc.cra.sbuild.domain.descriptor.RawMapping;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;

/**
 * <strong>What:</strong> SnakeYAML-backed {@link DescriptorCodec}.
 * <p>Parsing composes the node graph instead of loading into maps, so repeated keys survive as
 * separate {@link RawMapping} entries. Scalars are resolved with SnakeYAML's safe constructor
 * (booleans, numbers, strings, null).</p>
 * <p>Aliases are expanded into independent copies. Conversion stops with a
 * {@link DescriptorFormatException} once the expanded document exceeds {@value #MAX_NODES} nodes
 * or {@value #MAX_DEPTH} levels.</p>
 * <p>Writing emits block-style YAML of the validated fields in schema order.</p>
 * <p><strong>Thread-safety:</strong> Creates a {@link Yaml} instance per call; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class YamlDescriptorCodec implements DescriptorCodec {
  static final int MAX_DEPTH = 64;
  static final int MAX_NODES = 100_000;

  @Override
  public RawDocument parse(String source) throws DescriptorFormatException {
    Objects.requireNonNull(source, "source");
    LoaderOptions options = new LoaderOptions();
    Node root;
    try {
      root = new Yaml(options).compose(new StringReader(source));
    } catch (YAMLException ex) {
      throw new DescriptorFormatException("YAML syntax error: " + ex.getMessage(), ex);
    }
    if (root == null) {
      return new RawDocument(RawMapping.empty(), source);
    }
    if (!(root instanceof MappingNode mapping)) {
      throw new DescriptorFormatException("document root must be a mapping" + position(root));
    }
    NodeConverter converter = new NodeConverter(new ScalarConstructor(options));
    return new RawDocument(converter.toMapping(mapping, 0), source);
  }

  @Override
  public String write(BuildDescriptor descriptor) {
    Objects.requireNonNull(descriptor, "descriptor");
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    options.setIndent(2);
    options.setIndicatorIndent(2);
    options.setIndentWithIndicator(true);
    options.setSplitLines(false);
    options.setWidth(Integer.MAX_VALUE);
    return new Yaml(options).dump(descriptor.toPlainMap());
  }

  private static void checkDepth(Node node, int depth) throws DescriptorFormatException {
    if (depth > MAX_DEPTH) {
      throw new DescriptorFormatException("document nesting exceeds " + MAX_DEPTH + " levels" + position(node));
    }
  }

  private static String position(Node node) {
    Mark mark = node.getStartMark();
    return mark == null ? "" : " (line " + (mark.getLine() + 1) + ")";
  }

  /** Exposes SnakeYAML's tag-aware scalar construction for single nodes. */
  private static final class ScalarConstructor extends SafeConstructor {
    ScalarConstructor(LoaderOptions options) {
      super(options);
    }

    Object construct(Node node) {
      return constructObject(node);
    }
  }

  /** Converts one composed document; counts every node built, aliased or not. */
  private static final class NodeConverter {
    private final ScalarConstructor scalars;
    private int built;

    NodeConverter(ScalarConstructor scalars) {
      this.scalars = scalars;
    }

    RawMapping toMapping(MappingNode node, int depth) throws DescriptorFormatException {
      count(node, depth);
      List<RawMapping.Entry> entries = new ArrayList<>(node.getValue().size());
      for (NodeTuple tuple : node.getValue()) {
        if (!(tuple.getKeyNode() instanceof ScalarNode key)) {
          throw new DescriptorFormatException("mapping keys must be scalars" + position(tuple.getKeyNode()));
        }
        entries.add(new RawMapping.Entry(key.getValue(), toValue(tuple.getValueNode(), depth + 1)));
      }
      return new RawMapping(entries);
    }

    Object toValue(Node node, int depth) throws DescriptorFormatException {
      if (node instanceof MappingNode mapping) {
        return toMapping(mapping, depth);
      }
      count(node, depth);
      if (node instanceof SequenceNode sequence) {
        List<Object> items = new ArrayList<>(sequence.getValue().size());
        for (Node item : sequence.getValue()) {
          items.add(toValue(item, depth + 1));
        }
        return items;
      }
      try {
        return scalars.construct(node);
      } catch (YAMLException ex) {
        throw new DescriptorFormatException("invalid scalar" + position(node) + ": " + ex.getMessage(), ex);
      }
    }

    private void count(Node node, int depth) throws DescriptorFormatException {
      checkDepth(node, depth);
      if (++built > MAX_NODES) {
        throw new DescriptorFormatException(
            "document expands to more than " + MAX_NODES + " nodes" + position(node));
      }
    }
  }
}
