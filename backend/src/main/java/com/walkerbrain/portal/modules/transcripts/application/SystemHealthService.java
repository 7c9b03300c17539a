package com.walkerbrain.portal.modules.transcripts.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;

import com.walkerbrain.portal.global.web.ViewContext;
import com.walkerbrain.portal.modules.auth.application.AuthService;
import com.walkerbrain.portal.modules.query.application.CachedQueryExecutor;
import com.walkerbrain.portal.modules.query.application.FilterCompiler;
import com.walkerbrain.portal.modules.query.application.QueryRetrier;
import com.walkerbrain.portal.modules.query.application.RelationalStore;
import com.walkerbrain.portal.modules.query.application.RowNormalizer;
import com.walkerbrain.portal.modules.query.domain.CacheStatus;
import com.walkerbrain.portal.modules.query.domain.CompiledFilter;
import com.walkerbrain.portal.modules.query.domain.FilterSpec;
import com.walkerbrain.portal.modules.query.domain.QueryKey;
import com.walkerbrain.portal.modules.query.domain.QueryResult;
import com.walkerbrain.portal.modules.query.domain.QueryShape;
import com.walkerbrain.portal.modules.query.domain.ResultRow;
import com.walkerbrain.portal.modules.query.domain.SortOrder;
import com.walkerbrain.portal.modules.transcripts.domain.TranscriptSources;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.AdminHealthResponse;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.AdminHealthResponse.Budget;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.AdminHealthResponse.CostSummary;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.AdminHealthResponse.DailyCost;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.AdminHealthResponse.DriftAlert;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.AdminHealthResponse.Prompt;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.AdminHealthResponse.Throughput;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.SystemStatusResponse;

import org.springframework.stereotype.Service;

/**
 * Pipeline health: a short status for every user and the engineering detail for admins.
 */
@Service
public class SystemHealthService {

    static final int STATUS_WINDOW_DAYS = 7;
    static final int COST_WINDOW_DAYS = 30;
    static final int DRIFT_ALERT_LIMIT = 10;

    private final CachedQueryExecutor executor;
    private final RelationalStore store;
    private final RowNormalizer rowNormalizer;
    private final FilterCompiler filterCompiler;
    private final AuthService authService;
    private final QueryRetrier retrier;
    private final Clock clock;

    public SystemHealthService(
            CachedQueryExecutor executor,
            RelationalStore store,
            RowNormalizer rowNormalizer,
            FilterCompiler filterCompiler,
            AuthService authService,
            QueryRetrier retrier,
            Clock clock
    ) {
        this.executor = executor;
        this.store = store;
        this.rowNormalizer = rowNormalizer;
        this.filterCompiler = filterCompiler;
        this.authService = authService;
        this.retrier = retrier;
        this.clock = clock;
    }

    public SystemStatusResponse status() {
        QueryResult<List<ResultRow>> status = systemStatus();
        QueryResult<List<ResultRow>> recent = recentAnalyses();
        List<ResultRow> rows = recent.value();
        double averageQuality = rows.stream()
                .map(row -> row.getInteger("quality_score"))
                .filter(score -> score != null)
                .mapToInt(Integer::intValue)
                .average()
                .orElse(0);
        boolean allHits = status.isHit() && recent.isHit();
        return new SystemStatusResponse(
                isActive(status.value()),
                rows.size(),
                (double) rows.size() / STATUS_WINDOW_DAYS,
                averageQuality,
                allHits ? CacheStatus.HIT : CacheStatus.MISS
        );
    }

    public AdminHealthResponse adminHealth(ViewContext context) {
        authService.requireAdmin(context.principal());

        List<ResultRow> status = systemStatus().value();
        double budgetLimit = status.isEmpty() ? 0 : number(status.get(0).getDouble("daily_budget_limit"));
        double spend = status.isEmpty() ? 0 : number(status.get(0).getDouble("current_daily_spend"));
        Budget budget = new Budget(isActive(status), budgetLimit, spend, Math.max(0, budgetLimit - spend));

        return new AdminHealthResponse(
                budget,
                costs(),
                throughput(recentAnalyses().value()),
                driftAlerts(),
                activePrompts()
        );
    }

    private QueryResult<List<ResultRow>> systemStatus() {
        QueryKey key = QueryKey.builder(TranscriptSources.SYSTEM_STATUS, QueryShape.ROWS)
                .limit(1)
                .build();
        return retrier.withRetry("system:status", () -> executor.execute(key));
    }

    private QueryResult<List<ResultRow>> recentAnalyses() {
        OffsetDateTime since = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC)
                .truncatedTo(ChronoUnit.HOURS)
                .minusDays(STATUS_WINDOW_DAYS);
        CompiledFilter filter = filterCompiler.compile(List.of(new FilterSpec.Range("analyzed_at", since, null, false)));
        QueryKey key = QueryKey.builder(TranscriptSources.ANALYSIS_RESULTS, QueryShape.AGGREGATE)
                .variant("throughput:" + STATUS_WINDOW_DAYS)
                .columns("quality_score", "validation_passed")
                .filter(filter)
                .build();
        RelationalStore.SelectStatement statement = new RelationalStore.SelectStatement(
                key.source(), key.columns(), filter.predicates(), List.of(), null, null, false);
        return retrier.withRetry("system:throughput",
                () -> executor.execute(key, () -> rowNormalizer.normalize(store.select(statement))));
    }

    private CostSummary costs() {
        LocalDate cutoff = LocalDate.now(clock).minusDays(COST_WINDOW_DAYS);
        QueryKey key = QueryKey.builder(TranscriptSources.COST_TRACKING, QueryShape.ROWS)
                .columns("date", "total_cost", "calls_processed")
                .filter(filterCompiler.compile(List.of(FilterSpec.range("date", cutoff, null))))
                .orderBy(SortOrder.desc("date"))
                .build();
        List<DailyCost> days = retrier.withRetry("system:costs", () -> executor.execute(key)).value().stream()
                .map(row -> new DailyCost(
                        row.getLocalDate("date"),
                        number(row.getDouble("total_cost")),
                        row.has("calls_processed") ? row.getLong("calls_processed") : 0L))
                .toList();
        double total = days.stream().mapToDouble(DailyCost::totalCost).sum();
        long calls = days.stream().mapToLong(DailyCost::callsProcessed).sum();
        return new CostSummary(total, days.isEmpty() ? 0 : total / days.size(), calls, days);
    }

    static Throughput throughput(List<ResultRow> rows) {
        long passed = rows.stream().filter(row -> row.getBoolean("validation_passed")).count();
        double passRate = rows.isEmpty() ? 0 : passed * 100.0 / rows.size();
        return new Throughput(rows.size(), (double) rows.size() / STATUS_WINDOW_DAYS, passRate);
    }

    private List<DriftAlert> driftAlerts() {
        QueryKey key = QueryKey.builder(TranscriptSources.DRIFT_ALERTS, QueryShape.ROWS)
                .columns("created_at", "max_deviation", "drift_report")
                .orderBy(SortOrder.desc("created_at"))
                .limit(DRIFT_ALERT_LIMIT)
                .build();
        return retrier.withRetry("system:drift", () -> executor.execute(key)).value().stream()
                .map(row -> {
                    double deviation = number(row.getDouble("max_deviation"));
                    return new DriftAlert(
                            row.getOffsetDateTime("created_at"),
                            deviation,
                            severity(deviation),
                            row.has("drift_report") ? row.getString("drift_report") : "");
                })
                .toList();
    }

    private List<Prompt> activePrompts() {
        QueryKey key = QueryKey.builder(TranscriptSources.PROMPT_LIBRARY, QueryShape.ROWS)
                .columns("prompt_name", "prompt_version", "description")
                .filter(filterCompiler.compile(List.of(FilterSpec.equality("is_active", true))))
                .orderBy(SortOrder.desc("created_at"))
                .build();
        return retrier.withRetry("system:prompts", () -> executor.execute(key)).value().stream()
                .map(row -> new Prompt(
                        row.getString("prompt_name"),
                        row.getString("prompt_version"),
                        row.getString("description")))
                .toList();
    }

    static String severity(double maxDeviation) {
        if (maxDeviation > 3) {
            return "HIGH";
        }
        if (maxDeviation > 2) {
            return "MEDIUM";
        }
        return "LOW";
    }

    private static boolean isActive(List<ResultRow> status) {
        return !status.isEmpty() && status.get(0).getBoolean("system_active");
    }

    private static double number(Double value) {
        return value == null ? 0 : value;
    }
}
