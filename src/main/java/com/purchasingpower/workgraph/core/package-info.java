/**
 * Closed vocabularies of the work graph: item types and statuses, edge types,
 * graph container types and statuses, and error kinds.
 *
 * <p>Node and relationship labels used in Cypher:
 * <ul>
 *   <li>{@code (:WorkItem)} - a unit of work</li>
 *   <li>{@code (:Contributor)} - linked by {@code (WorkItem)-[:WORKED_ON_BY]->(Contributor)}</li>
 *   <li>{@code (:Graph)} - linked by {@code (WorkItem)-[:BELONGS_TO]->(Graph)}</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.purchasingpower.workgraph.core;
