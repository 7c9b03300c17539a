package com.walkerbrain.portal.modules.transcripts.domain;

import java.util.List;

/**
 * Tables, procedures and column groups read by the dashboard.
 */
public final class TranscriptSources {

    public static final String ANALYSIS_RESULTS = "analysis_results";
    public static final String TESTIMONIAL_PIPELINE = "testimonial_pipeline";
    public static final String CONTENT_GENERATION_QUEUE = "content_generation_queue";
    public static final String ANGLE_FEEDBACK = "angle_feedback";
    public static final String SYSTEM_STATUS = "system_status";
    public static final String COST_TRACKING = "cost_tracking";
    public static final String DRIFT_ALERTS = "drift_alerts";
    public static final String PROMPT_LIBRARY = "prompt_library";
    public static final String SEARCH_TRANSCRIPTS = "search_transcripts";
    public static final String MASTER_TAXONOMY = "master_taxonomy";
    public static final String OBJECTION_FREQUENCIES = "v_objection_frequencies";

    public static final List<String> TEXT_SEARCH_COLUMNS = List.of("summary", "key_quote", "primary_topic");

    public static final List<String> QUOTE_COLUMNS = List.of(
            "source_transcript_id", "key_quote", "case_type", "emotional_tone",
            "quality_score", "original_language", "suggested_tags", "analyzed_at",
            "testimonial_candidate", "testimonial_type", "verbatim_customer_language"
    );

    public static final List<String> SEARCH_COLUMNS = List.of(
            "source_transcript_id", "case_type", "quality_score", "emotional_tone",
            "outcome", "analyzed_at", "original_language", "key_quote", "summary",
            "primary_topic", "suggested_tags", "content_generation_flag",
            "testimonial_candidate", "testimonial_type", "confidence_score",
            "estimated_case_value_category"
    );

    public static final List<String> DETAIL_COLUMNS = List.of(
            "quality_sub_scores", "agent_empathy_score", "agent_education_quality",
            "agent_objection_handling", "agent_closing_effectiveness",
            "liability_clarity", "injury_severity", "documentation_quality",
            "estimated_case_value_low", "estimated_case_value_high",
            "objection_categories", "conversion_driver", "drop_off_reason",
            "moment_that_closed", "communication_style", "spanglish_detected",
            "colloquialisms", "cultural_markers", "family_references",
            "common_questions_asked", "misunderstandings", "process_confusion_points",
            "other_brands_mentioned", "repeated_questions_from_caller",
            "opening_emotional_state", "mid_call_emotional_shift", "end_state_emotion",
            "prompt_version_used", "validation_passed", "api_cost", "input_tokens", "output_tokens"
    );

    public static final List<String> TAGGED_CALL_COLUMNS = List.of(
            "source_transcript_id", "case_type", "quality_score", "emotional_tone",
            "analyzed_at", "key_quote", "summary", "suggested_tags"
    );

    private TranscriptSources() {
    }
}
