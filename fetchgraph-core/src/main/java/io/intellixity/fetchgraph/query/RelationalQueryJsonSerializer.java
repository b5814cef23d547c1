package io.intellixity.fetchgraph.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/**
 * Canonical selector JSON for {@link RelationalQuery}.
 * <p>
 * Every field is written, always in the same order, so equal queries produce identical bytes.
 */
public final class RelationalQueryJsonSerializer extends JsonSerializer<RelationalQuery> {
  @Override
  public void serialize(RelationalQuery q, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (q == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    g.writeStringField("op", "query");
    g.writeStringField("root_entity", q.rootEntity());

    g.writeArrayFieldStart("select");
    for (SelectExpr s : q.select()) {
      g.writeStartObject();
      g.writeStringField("expr", s.expr());
      writeNullableString(g, "alias", s.alias());
      g.writeEndObject();
    }
    g.writeEndArray();

    g.writeFieldName("filters");
    writeFilter(q.filters(), g, serializers);

    g.writeArrayFieldStart("relations");
    for (String r : q.relations()) g.writeString(r);
    g.writeEndArray();

    g.writeArrayFieldStart("semantic_clauses");
    for (SemanticClause sc : q.semanticClauses()) {
      g.writeStartObject();
      g.writeStringField("entity", sc.entity());
      g.writeArrayFieldStart("fields");
      for (String f : sc.fields()) g.writeString(f);
      g.writeEndArray();
      g.writeStringField("query", sc.query());
      g.writeNumberField("top_k", sc.topK());
      if (sc.threshold() == null) g.writeNullField("threshold");
      else g.writeNumberField("threshold", sc.threshold());
      g.writeStringField("mode", sc.mode().symbol());
      g.writeEndObject();
    }
    g.writeEndArray();

    g.writeArrayFieldStart("group_by");
    for (GroupBySpec gb : q.groupBy()) {
      g.writeStartObject();
      writeNullableString(g, "entity", gb.entity());
      g.writeStringField("field", gb.field());
      writeNullableString(g, "alias", gb.alias());
      g.writeEndObject();
    }
    g.writeEndArray();

    g.writeArrayFieldStart("aggregations");
    for (AggregationSpec a : q.aggregations()) {
      g.writeStartObject();
      g.writeStringField("field", a.field());
      g.writeStringField("agg", a.agg().symbol());
      writeNullableString(g, "alias", a.alias());
      g.writeEndObject();
    }
    g.writeEndArray();

    if (q.limit() == null) g.writeNullField("limit");
    else g.writeNumberField("limit", q.limit());
    g.writeNumberField("offset", q.offset());
    g.writeBooleanField("case_sensitivity", q.caseSensitivity());
    g.writeEndObject();
  }

  private static void writeNullableString(JsonGenerator g, String name, String value) throws IOException {
    if (value == null) g.writeNullField(name);
    else g.writeStringField(name, value);
  }

  private static void writeFilter(FilterClause f, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (f == null) {
      g.writeNull();
      return;
    }
    if (f instanceof LogicalFilter lf) {
      g.writeStartObject();
      g.writeStringField("type", "logical");
      g.writeStringField("op", lf.op().symbol());
      g.writeArrayFieldStart("clauses");
      for (FilterClause child : lf.clauses()) writeFilter(child, g, serializers);
      g.writeEndArray();
      g.writeEndObject();
      return;
    }
    ComparisonFilter c = (ComparisonFilter) f;
    g.writeStartObject();
    g.writeStringField("type", "comparison");
    writeNullableString(g, "entity", c.entity());
    g.writeStringField("field", c.field());
    g.writeStringField("op", c.op().symbol());
    g.writeFieldName("value");
    serializers.defaultSerializeValue(c.value(), g);
    g.writeEndObject();
  }
}
