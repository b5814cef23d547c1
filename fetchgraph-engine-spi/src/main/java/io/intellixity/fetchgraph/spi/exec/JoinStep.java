package io.intellixity.fetchgraph.spi.exec;

import io.intellixity.fetchgraph.schema.EntityDescriptor;
import io.intellixity.fetchgraph.schema.JoinType;
import io.intellixity.fetchgraph.schema.RelationDescriptor;

/**
 * One join in plan order: {@code leftAlias.leftColumn = alias.rightColumn}.
 * <p>
 * The left side is whichever endpoint of {@code relation} was already present; {@code entity} is the other one.
 *
 * @param label prefix used for this table's columns in the default projection
 */
public record JoinStep(RelationDescriptor relation,
                       String alias,
                       EntityDescriptor entity,
                       String leftAlias,
                       String leftColumn,
                       String rightColumn,
                       JoinType type,
                       String label) {
}
