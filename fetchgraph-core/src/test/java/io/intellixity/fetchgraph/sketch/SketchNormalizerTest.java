package io.intellixity.fetchgraph.sketch;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class SketchNormalizerTest {
  private final SketchReader reader = new SketchReader(new SketchParser(), new SketchNormalizer(SketchSettings.builtIn()));

  private SketchReader.Result read(String relaxedJson) {
    return reader.read(relaxedJson);
  }

  private static List<WhereNode> all(NormalizedSketch s) {
    return ((WhereGroup) s.where()).all();
  }

  @Test
  void keyAliasesMapToCanonicalKeys() {
    SketchReader.Result r = read("{'root':'orders','find':[['status','shipped']],'select':['id'],'limit':5,'offset':2}");
    NormalizedSketch s = r.sketch();
    assertEquals("orders", s.from());
    assertEquals(List.of("id"), s.get());
    assertEquals(5, s.take());
    assertEquals(2, s.skip());
    assertEquals(List.of(new Clause("status", "is", "shipped")), all(s));
    assertFalse(r.diagnostics().hasErrors());
  }

  @Test
  void defaultsApplyWhenOptionalKeysAreMissing() {
    SketchReader.Result r = read("{'from':'orders','where':[]}");
    NormalizedSketch s = r.sketch();
    assertEquals(List.of("*"), s.get());
    assertEquals(List.of(), s.with());
    assertEquals(200, s.take());
    assertEquals(0, s.skip());
    assertNull(s.caseSensitive());
    assertTrue(s.selectsAll());
  }

  @Test
  void unknownAndDuplicateKeysWarn() {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("from", "orders");
    data.put("root", "customers");
    data.put("colour", "red");
    data.put("where", List.of());
    Diagnostics d = new Diagnostics();
    NormalizedSketch s = new SketchNormalizer(SketchSettings.builtIn()).normalize(data, d);
    assertEquals("orders", s.from());
    assertTrue(d.hasCode(DiagnosticCodes.DUPLICATE_KEY));
    assertTrue(d.hasCode(DiagnosticCodes.UNKNOWN_KEY));
    assertFalse(d.hasErrors());
  }

  @Test
  void missingFromIsErrorAndMissingWhereIsWarning() {
    SketchReader.Result r = read("{'get':['id']}");
    assertTrue(r.diagnostics().hasCode(DiagnosticCodes.MISSING_REQUIRED_KEY));
    assertTrue(r.diagnostics().hasCode(DiagnosticCodes.MISSING_WHERE));
    assertEquals("", r.sketch().from());
    assertNull(r.sketch().where());
  }

  @Test
  void operatorsAreInferredFromValues() {
    NormalizedSketch s = read("{'from':'orders','where':[['status','shipped'],['total',10],['flag',true],"
        + "['created',['2024-01-01','2024-02-01']],['id',[1,2,3]]]}").sketch();
    List<String> ops = all(s).stream().map(n -> ((Clause) n).op()).toList();
    assertEquals(List.of("is", "=", "=", "between", "in"), ops);
  }

  @Test
  void operatorAliasesAndAutocorrect() {
    SketchReader.Result r = read("{'from':'orders','where':[['total','gte',10],['status','equals','x'],['name','contans','al']]}");
    List<String> ops = all(r.sketch()).stream().map(n -> ((Clause) n).op()).toList();
    assertEquals(List.of(">=", "=", "contains"), ops);
    assertTrue(r.diagnostics().hasCode(DiagnosticCodes.OP_AUTOCORRECT));
    assertFalse(r.diagnostics().hasErrors());
  }

  @Test
  void unknownOperatorDropsClause() {
    SketchReader.Result r = read("{'from':'orders','where':[['total','frobnicate',10],['status','shipped']]}");
    assertEquals(1, all(r.sketch()).size());
    assertTrue(r.diagnostics().hasCode(DiagnosticCodes.UNKNOWN_OP));
  }

  @Test
  void badArityAndPathAreReported() {
    SketchReader.Result r = read("{'from':'orders','where':[['only'],[1,'=',2],['a','b','c','d']]}");
    assertTrue(all(r.sketch()).isEmpty());
    assertTrue(r.diagnostics().hasCode(DiagnosticCodes.BAD_CLAUSE_ARITY));
    assertTrue(r.diagnostics().hasCode(DiagnosticCodes.BAD_CLAUSE_PATH));
  }

  @Test
  void nestedListBecomesAllGroup() {
    NormalizedSketch s = read("{'from':'orders','where':[[['a',1],['b',2]],['c',3]]}").sketch();
    List<WhereNode> top = all(s);
    assertEquals(2, top.size());
    WhereGroup nested = (WhereGroup) top.get(0);
    assertEquals(List.of(new Clause("a", "=", 1), new Clause("b", "=", 2)), nested.all());
  }

  @Test
  void objectWhereKeepsAllAnyNot() {
    NormalizedSketch s = read("{'from':'orders','where':{'any':[['a',1],['b',2]],'not':['c','x'],'oops':1}}").sketch();
    WhereGroup g = (WhereGroup) s.where();
    assertTrue(g.all().isEmpty());
    assertEquals(2, g.any().size());
    assertEquals(new Clause("c", "is", "x"), g.not());
  }

  @Test
  void flatComparisonObjectUsesEntityAsQualifier() {
    NormalizedSketch s = read("{'from':'orders','where':[{'type':'comparison','entity':'customers','field':'name','op':'=','value':'Alice'}]}").sketch();
    assertEquals(new Clause("customers.name", "=", "Alice"), all(s).get(0));
  }

  @Test
  void emptyWhereObjectIsIgnoredWithWarning() {
    SketchReader.Result r = read("{'from':'orders','where':{}}");
    assertTrue(((WhereGroup) r.sketch().where()).isEmpty());
    assertTrue(r.diagnostics().hasCode(DiagnosticCodes.EMPTY_WHERE_OBJECT));
  }

  @Test
  void scalarWhereIsRejected() {
    SketchReader.Result r = read("{'from':'orders','where':'status is shipped'}");
    assertNull(r.sketch().where());
    assertTrue(r.diagnostics().hasCode(DiagnosticCodes.BAD_WHERE_TYPE));
  }

  @Test
  void takeAndSkipAreCoerced() {
    assertEquals(7, read("{'from':'orders','where':[],'take':'7'}").sketch().take());
    SketchReader.Result bad = read("{'from':'orders','where':[],'take':-3,'skip':'x'}");
    assertEquals(200, bad.sketch().take());
    assertEquals(0, bad.sketch().skip());
    assertTrue(bad.diagnostics().hasCode(DiagnosticCodes.INVALID_TAKE));
    assertTrue(bad.diagnostics().hasCode(DiagnosticCodes.INVALID_SKIP));
  }

  @Test
  void caseFlagAcceptsBooleansOnly() {
    assertEquals(Boolean.TRUE, read("{'from':'o','where':[],'case_sensitive':true}").sketch().caseSensitive());
    assertEquals(Boolean.FALSE, read("{'from':'o','where':[],'case_sensitivity':'false'}").sketch().caseSensitive());
    SketchReader.Result r = read("{'from':'o','where':[],'case_sensitive':'maybe'}");
    assertNull(r.sketch().caseSensitive());
    assertTrue(r.diagnostics().hasCode(DiagnosticCodes.BAD_CASE_FLAG));
  }

  @Test
  void withAndGetAcceptSingleStrings() {
    NormalizedSketch s = read("{'from':'orders','where':[],'with':'customer','get':'customer.name'}").sketch();
    assertEquals(List.of("customer"), s.with());
    assertEquals(List.of("customer.name"), s.get());
  }

  @Test
  void parseFailureYieldsEmptySketch() {
    SketchReader.Result r = reader.read("[]");
    assertTrue(r.diagnostics().hasCode(DiagnosticCodes.PARSE_ERROR));
    assertEquals("", r.sketch().from());
  }

  @Test
  void settingsResourceOverlaysBuiltIns() {
    SketchSettings loaded = SketchSettings.load();
    assertEquals(200, loaded.defaultTake());
    assertEquals("from", loaded.canonicalKey("ROOT_ENTITY"));
    assertEquals(">=", loaded.operatorAliases().get("gte"));
    assertNull(loaded.canonicalKey("colour"));
  }
}
