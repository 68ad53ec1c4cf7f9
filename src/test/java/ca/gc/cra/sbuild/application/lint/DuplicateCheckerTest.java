package ca.gc.cra.sbuild.application.lint;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sbuild.domain.descriptor.DistroPkg;
import ca.gc.cra.sbuild.domain.diagnostic.Diagnostic;
import ca.gc.cra.sbuild.domain.diagnostic.DiagnosticStore;
import ca.gc.cra.sbuild.domain.diagnostic.Severity;
import java.util.List;
import org.junit.jupiter.api.Test;

class DuplicateCheckerTest {

  @Test
  void reportsRepeatedListValueOncePerField() {
    DiagnosticStore store = new DiagnosticStore();
    new DuplicateChecker(store).checkDuplicateValues(List.of("a", "b", "a", "a"), "tag", 7);

    List<Diagnostic> diagnostics = store.diagnostics();
    assertEquals(1, diagnostics.size());
    assertEquals("Duplicate value 'a' found in tag", diagnostics.get(0).message());
    assertEquals(7, diagnostics.get(0).line());
    assertEquals(Severity.ERROR, diagnostics.get(0).severity());
  }

  @Test
  void distinctValuesProduceNothing() {
    DiagnosticStore store = new DiagnosticStore();
    new DuplicateChecker(store).checkDuplicateValues(List.of("a", "b", "c"), "tag", 1);
    assertTrue(store.isEmpty());
  }

  @Test
  void repeatedNestedPathIsReportedOnceWithoutDescending() {
    DistroPkg tree = node(
        child("distro", node(
            child("fedora", node(child("fedora", new DistroPkg.PackageList(List.of("a", "a"))))),
            child("fedora", node(child("fedora", new DistroPkg.PackageList(List.of("b", "b"))))))));
    DiagnosticStore store = new DiagnosticStore();

    new DuplicateChecker(store).checkDistroPkgDuplicates(tree, "", 12);

    Diagnostic duplicate = store.get("distro.fedora");
    assertEquals("'distro.fedora' field is duplicated", duplicate.message());
    assertEquals(Severity.ERROR, duplicate.severity());
    // only the first subtree was walked, so only its package duplicate shows up
    assertEquals("Duplicate value 'a' found in distro.fedora.fedora", store.get("distro.fedora.fedora").message());
    assertEquals(2, store.errorCount());
  }

  @Test
  void sameKeyUnderDifferentParentsIsNotADuplicate() {
    DistroPkg tree = node(
        child("debian", node(child("bookworm", new DistroPkg.PackageList(List.of("curl"))))),
        child("ubuntu", node(child("bookworm", new DistroPkg.PackageList(List.of("curl"))))));
    DiagnosticStore store = new DiagnosticStore();

    new DuplicateChecker(store).checkDistroPkgDuplicates(tree, "", 3);

    assertTrue(store.isEmpty());
  }

  @Test
  void eachTraversalStartsWithAFreshVisitedSet() {
    DistroPkg tree = node(child("alpine", new DistroPkg.PackageList(List.of("curl"))));
    DiagnosticStore store = new DiagnosticStore();
    DuplicateChecker checker = new DuplicateChecker(store);

    checker.checkDistroPkgDuplicates(tree, "", 1);
    checker.checkDistroPkgDuplicates(tree, "", 1);

    assertTrue(store.isEmpty());
  }

  private static DistroPkg node(DistroPkg.Child... children) {
    return new DistroPkg.InnerNode(List.of(children));
  }

  private static DistroPkg.Child child(String key, DistroPkg value) {
    return new DistroPkg.Child(key, value);
  }
}
