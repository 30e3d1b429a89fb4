package com.purchasingpower.workgraph.analytics;

import java.util.Map;

/**
 * Views of contributors' work: one contributor at a time, per graph, and across pairs.
 *
 * @since 1.0.0
 */
public interface ContributorAnalyticsService {

    /**
     * The contributor's items ranked by the requested priority, with dependency hints.
     *
     * @throws com.purchasingpower.workgraph.exception.GraphOperationException
     *         NOT_FOUND when the contributor does not exist
     */
    Map<String, Object> getContributorPriorities(ContributorPriorityQuery query);

    /**
     * Item counts by status, blocked ratio and average priority for one contributor.
     *
     * @throws com.purchasingpower.workgraph.exception.GraphOperationException
     *         NOT_FOUND when the contributor does not exist
     */
    Map<String, Object> getContributorWorkload(String contributorId);

    /**
     * Contributors with items in the matching graphs, one row per contributor and graph.
     */
    Map<String, Object> findContributorsByProject(ProjectContributorsQuery query);

    /**
     * Everyone working on items of one graph, with per-member and team totals.
     *
     * @throws com.purchasingpower.workgraph.exception.GraphOperationException
     *         NOT_FOUND when the graph does not exist
     */
    Map<String, Object> getProjectTeam(String graphId);

    /**
     * Completion statistics and per work-type expertise levels over recently updated items.
     *
     * @throws com.purchasingpower.workgraph.exception.GraphOperationException
     *         NOT_FOUND when the contributor does not exist
     */
    Map<String, Object> getContributorExpertise(ExpertiseQuery query);

    /**
     * Contributor pairs sharing work items, strongest first.
     */
    Map<String, Object> getCollaborationNetwork(CollaborationQuery query);

    /**
     * Active load, availability class and overload risk per contributor.
     */
    Map<String, Object> getContributorAvailability(AvailabilityQuery query);
}
