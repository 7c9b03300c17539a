package com.walkerbrain.portal.modules.transcripts.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.walkerbrain.portal.global.error.ProblemException;
import com.walkerbrain.portal.modules.query.application.CachedQueryExecutor;
import com.walkerbrain.portal.modules.query.application.FilterCompiler;
import com.walkerbrain.portal.modules.query.application.QueryRetrier;
import com.walkerbrain.portal.modules.query.domain.CacheStatus;
import com.walkerbrain.portal.modules.query.domain.CompiledFilter;
import com.walkerbrain.portal.modules.query.domain.FilterSpec;
import com.walkerbrain.portal.modules.query.domain.QueryKey;
import com.walkerbrain.portal.modules.query.domain.QueryResult;
import com.walkerbrain.portal.modules.query.domain.QueryShape;
import com.walkerbrain.portal.modules.query.domain.ResultRow;
import com.walkerbrain.portal.modules.query.domain.SortOrder;
import com.walkerbrain.portal.modules.transcripts.domain.TranscriptSources;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.ObjectionInsightsResponse;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.ObjectionInsightsResponse.ObjectionTrend;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.TagBrowserResponse;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.TagBrowserResponse.TagCategory;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.TagBrowserResponse.TagCount;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.TaggedCallResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * Tag browser and objection trends.
 *
 * <p>Both prefer a curated source (the tag taxonomy, the weekly objection view) and fall back to mining
 * {@code analysis_results} when that source is empty.
 */
@Service
public class SignalsService {

    private static final Logger log = LoggerFactory.getLogger(SignalsService.class);

    static final int MINED_ROW_LIMIT = 1000;
    static final int MINED_TAG_LIMIT = 50;
    static final int TAGGED_CALL_LIMIT = 20;
    static final int RECENT_OBJECTION_DAYS = 7;

    /** A baseline week needs at least this share of the current week's volume. */
    static final double BASELINE_SHARE = 0.10;

    static final Set<String> JUNK_CATEGORIES = Set.of("undefined", "none", "null", "n/a", "");

    private final CachedQueryExecutor executor;
    private final FilterCompiler filterCompiler;
    private final QueryRetrier retrier;
    private final Clock clock;

    public SignalsService(
            CachedQueryExecutor executor,
            FilterCompiler filterCompiler,
            QueryRetrier retrier,
            Clock clock
    ) {
        this.executor = executor;
        this.filterCompiler = filterCompiler;
        this.retrier = retrier;
        this.clock = clock;
    }

    /**
     * @param search case-insensitive substring matched against tag names; blank matches every tag
     */
    public TagBrowserResponse tags(String search) {
        String needle = search == null ? "" : search.trim().toLowerCase(Locale.ROOT);

        QueryKey taxonomyKey = QueryKey.builder(TranscriptSources.MASTER_TAXONOMY, QueryShape.ROWS)
                .columns("tag_id", "tag_name", "parent_tag_id", "usage_count")
                .orderBy(SortOrder.asc("tag_name"))
                .build();
        QueryResult<List<ResultRow>> taxonomy = retrier.withRetry("signals:taxonomy",
                () -> executor.execute(taxonomyKey));
        if (!taxonomy.value().isEmpty()) {
            return fromTaxonomy(taxonomy.value(), needle, taxonomy.cacheStatus());
        }

        log.debug("Tag taxonomy is empty, mining suggested tags");
        QueryKey minedKey = QueryKey.builder(TranscriptSources.ANALYSIS_RESULTS, QueryShape.ROWS)
                .variant("mined-tags")
                .columns("suggested_tags")
                .filter(filterCompiler.compile(List.of(FilterSpec.nullCheck("suggested_tags", true))))
                .orderBy(SortOrder.desc("analyzed_at"))
                .limit(MINED_ROW_LIMIT)
                .build();
        QueryResult<List<ResultRow>> mined = retrier.withRetry("signals:mined-tags",
                () -> executor.execute(minedKey));
        List<TagCount> top = topTags(mined.value()).stream()
                .filter(count -> matches(count.tag(), needle))
                .toList();
        return new TagBrowserResponse("analysis", List.of(), top,
                QuoteBankService.combine(taxonomy.cacheStatus(), mined.cacheStatus()));
    }

    public QueryResult<List<TaggedCallResponse>> callsWithTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "BLANK_TAG", "Tag must not be blank.");
        }
        CompiledFilter filter = filterCompiler.compile(
                List.of(FilterSpec.hasElement("suggested_tags", tag.trim())));
        QueryKey key = QueryKey.builder(TranscriptSources.ANALYSIS_RESULTS, QueryShape.ROWS)
                .variant("tagged-calls")
                .columns(TranscriptSources.TAGGED_CALL_COLUMNS)
                .filter(filter)
                .orderBy(SortOrder.desc("quality_score"))
                .limit(TAGGED_CALL_LIMIT)
                .build();
        return retrier.withRetry("signals:tagged-calls", () -> executor.execute(key))
                .map(rows -> rows.stream().map(TaggedCallResponse::from).toList());
    }

    public ObjectionInsightsResponse objections() {
        QueryKey weeklyKey = QueryKey.builder(TranscriptSources.OBJECTION_FREQUENCIES, QueryShape.ROWS)
                .columns("obj_category", "freq_this_week", "freq_last_week")
                .build();
        QueryResult<List<ResultRow>> weekly = retrier.withRetry("signals:objections-weekly",
                () -> executor.execute(weeklyKey));
        if (!weekly.value().isEmpty()) {
            return fromWeekly(weekly.value(), weekly.cacheStatus());
        }

        OffsetDateTime since = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC)
                .minusDays(RECENT_OBJECTION_DAYS)
                .truncatedTo(ChronoUnit.HOURS);
        QueryKey recentKey = QueryKey.builder(TranscriptSources.ANALYSIS_RESULTS, QueryShape.ROWS)
                .variant("recent-objections:" + RECENT_OBJECTION_DAYS)
                .columns("objection_categories")
                .filter(filterCompiler.compile(List.of(
                        FilterSpec.nullCheck("objection_categories", true),
                        new FilterSpec.Range("analyzed_at", since, null, false)
                )))
                .build();
        QueryResult<List<ResultRow>> recent = retrier.withRetry("signals:objections-recent",
                () -> executor.execute(recentKey));

        Map<String, Long> counts = new HashMap<>();
        for (ResultRow row : recent.value()) {
            for (String category : row.getStringList("objection_categories")) {
                if (!isJunk(category)) {
                    counts.merge(category, 1L, Long::sum);
                }
            }
        }
        List<ObjectionTrend> trends = new ArrayList<>();
        counts.forEach((category, count) ->
                trends.add(new ObjectionTrend(category, label(category), count, 0, count)));
        trends.sort(byVolume());
        long total = trends.stream().mapToLong(ObjectionTrend::thisWeek).sum();
        return new ObjectionInsightsResponse("recent", false, total, 0, trends,
                QuoteBankService.combine(weekly.cacheStatus(), recent.cacheStatus()));
    }

    static TagBrowserResponse fromTaxonomy(List<ResultRow> rows, String needle, CacheStatus status) {
        Map<Long, String> names = new HashMap<>();
        for (ResultRow row : rows) {
            Long id = row.getLong("tag_id");
            if (id != null) {
                names.put(id, row.getString("tag_name"));
            }
        }

        Map<Long, List<TagCount>> children = new LinkedHashMap<>();
        List<TagCount> topLevel = new ArrayList<>();
        for (ResultRow row : rows) {
            String name = row.getString("tag_name");
            if (name == null || !matches(name, needle)) {
                continue;
            }
            Long usage = row.getLong("usage_count");
            TagCount tag = new TagCount(name, usage == null ? 0 : usage);
            Long parentId = row.getLong("parent_tag_id");
            if (parentId == null) {
                topLevel.add(tag);
            } else {
                children.computeIfAbsent(parentId, ignored -> new ArrayList<>()).add(tag);
            }
        }

        List<TagCategory> categories = new ArrayList<>();
        children.forEach((parentId, tags) -> categories.add(
                new TagCategory(names.getOrDefault(parentId, "Category " + parentId), List.copyOf(tags))));
        categories.sort(Comparator.comparing(TagCategory::name));
        return new TagBrowserResponse("taxonomy", categories, topLevel, status);
    }

    /**
     * Most frequent non-blank tags, ties broken alphabetically.
     */
    static List<TagCount> topTags(List<ResultRow> rows) {
        Map<String, Long> counts = new HashMap<>();
        for (ResultRow row : rows) {
            for (String tag : row.getStringList("suggested_tags")) {
                if (!tag.isBlank()) {
                    counts.merge(tag, 1L, Long::sum);
                }
            }
        }
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
                        .thenComparing(Map.Entry.<String, Long>comparingByKey()))
                .limit(MINED_TAG_LIMIT)
                .map(entry -> new TagCount(entry.getKey(), entry.getValue()))
                .toList();
    }

    static ObjectionInsightsResponse fromWeekly(List<ResultRow> rows, CacheStatus status) {
        List<ObjectionTrend> trends = new ArrayList<>();
        long totalThis = 0;
        long totalLast = 0;
        for (ResultRow row : rows) {
            String category = row.getString("obj_category");
            if (isJunk(category)) {
                continue;
            }
            long thisWeek = valueOrZero(row.getLong("freq_this_week"));
            long lastWeek = valueOrZero(row.getLong("freq_last_week"));
            totalThis += thisWeek;
            totalLast += lastWeek;
            trends.add(new ObjectionTrend(category, label(category), thisWeek, lastWeek, thisWeek - lastWeek));
        }
        trends.sort(byVolume());
        return new ObjectionInsightsResponse("weekly", hasBaseline(totalThis, totalLast), totalThis, totalLast,
                trends, status);
    }

    static boolean hasBaseline(long totalThisWeek, long totalLastWeek) {
        return totalLastWeek > 0 && totalLastWeek >= totalThisWeek * BASELINE_SHARE;
    }

    static boolean isJunk(String category) {
        return category == null || JUNK_CATEGORIES.contains(category.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * "price_too_high" becomes "Price Too High".
     */
    static String label(String category) {
        String spaced = category.replace('_', ' ');
        StringBuilder label = new StringBuilder(spaced.length());
        boolean previousLetter = false;
        for (int i = 0; i < spaced.length(); i++) {
            char c = spaced.charAt(i);
            label.append(previousLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
            previousLetter = Character.isLetter(c);
        }
        return label.toString();
    }

    private static boolean matches(String tag, String needle) {
        return needle.isEmpty() || tag.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static long valueOrZero(Long value) {
        return value == null ? 0 : value;
    }

    private static Comparator<ObjectionTrend> byVolume() {
        return Comparator.comparingLong(ObjectionTrend::thisWeek).reversed()
                .thenComparing(ObjectionTrend::category);
    }
}
