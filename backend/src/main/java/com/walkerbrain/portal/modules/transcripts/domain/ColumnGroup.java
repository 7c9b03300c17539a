package com.walkerbrain.portal.modules.transcripts.domain;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.walkerbrain.portal.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * Named column sets the data explorer projects {@code analysis_results} through.
 */
public enum ColumnGroup {

    CORE("Core", List.of(
            "source_transcript_id", "case_type", "quality_score", "emotional_tone", "outcome", "analyzed_at")),
    QUALITY_SUB_SCORES("Quality Sub-Scores", List.of("quality_sub_scores")),
    AGENT_SCORES("Agent Scores", List.of(
            "agent_empathy_score", "agent_education_quality", "agent_objection_handling",
            "agent_closing_effectiveness")),
    CASE_ASSESSMENT("Case Assessment", List.of(
            "liability_clarity", "injury_severity", "documentation_quality",
            "estimated_case_value_low", "estimated_case_value_high")),
    OBJECTION_TAXONOMY("Objection Taxonomy", List.of(
            "objection_categories", "mid_call_dropout_moment", "conversion_driver", "drop_off_reason",
            "agent_intervention_that_worked", "moment_that_closed")),
    LANGUAGE_AND_CULTURE("Language & Culture", List.of(
            "reading_level_estimate", "communication_style", "spanglish_detected", "colloquialisms",
            "cultural_markers", "family_references", "verbatim_customer_language")),
    CX_INTELLIGENCE("CX Intelligence", List.of(
            "questions_repeated_by_attorney", "attorney_used_prior_info", "handoff_wait_time_mentioned",
            "attorney_sentiment", "attorney_rejection_reason", "testimonial_candidate", "testimonial_type",
            "review_request_eligible")),
    CONTENT_MINING("Content Mining", List.of(
            "common_questions_asked", "misunderstandings", "education_calming_moment",
            "process_confusion_points", "other_brands_mentioned", "competitive_comparison",
            "category_confusion", "ad_or_creative_referenced", "ad_promise_vs_reality_mismatch",
            "repeated_questions_from_caller")),
    EMOTIONAL_ARC("Emotional Arc", List.of(
            "opening_emotional_state", "mid_call_emotional_shift", "end_state_emotion")),
    METADATA("Metadata", List.of(
            "prompt_version_used", "confidence_score", "validation_passed", "api_cost", "input_tokens",
            "output_tokens", "analysis_type"));

    private final String label;
    private final List<String> columns;

    ColumnGroup(String label, List<String> columns) {
        this.label = label;
        this.columns = columns;
    }

    public String getLabel() {
        return label;
    }

    public List<String> getColumns() {
        return columns;
    }

    /**
     * Accepts the enum name in any case, with hyphens for underscores.
     */
    public static ColumnGroup from(String value) {
        if (value == null || value.isBlank()) {
            throw unknown(value);
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (ColumnGroup group : values()) {
            if (group.name().equals(normalized)) {
                return group;
            }
        }
        throw unknown(value);
    }

    /**
     * Columns of {@code groups} in group order, each column once.
     */
    public static List<String> columnsOf(Collection<ColumnGroup> groups) {
        if (groups == null || groups.isEmpty()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "NO_COLUMN_GROUP",
                    "Select at least one column group.");
        }
        Set<String> columns = new LinkedHashSet<>();
        for (ColumnGroup group : values()) {
            if (groups.contains(group)) {
                columns.addAll(group.columns);
            }
        }
        return List.copyOf(columns);
    }

    private static ProblemException unknown(String value) {
        return new ProblemException(HttpStatus.BAD_REQUEST, "UNKNOWN_COLUMN_GROUP",
                "Unknown column group: " + value);
    }
}
