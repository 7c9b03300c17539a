package com.walkerbrain.portal.modules.query.application;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.walkerbrain.portal.modules.query.domain.CompiledFilter;
import com.walkerbrain.portal.modules.query.domain.ResultRow;
import com.walkerbrain.portal.modules.query.domain.StorePredicate;

import org.springframework.stereotype.Component;

/**
 * Applies compiled predicates to rows already in memory, for filters over values the store cannot index
 * (fields parsed out of JSON content). Follows the store's semantics: ILIKE patterns honour backslash
 * escapes, and a list-valued column satisfies EQ or IN when any element matches.
 */
@Component
public class PredicateEvaluator {

    static final int PATTERN_CACHE_SIZE = 512;

    private final LoadingCache<String, Pattern> patternCache = Caffeine.newBuilder()
            .maximumSize(PATTERN_CACHE_SIZE)
            .executor(Runnable::run)
            .build(PredicateEvaluator::toRegex);

    public boolean matches(ResultRow row, CompiledFilter filter) {
        for (StorePredicate predicate : filter.predicates()) {
            if (!matches(row, predicate)) {
                return false;
            }
        }
        return true;
    }

    public boolean matches(ResultRow row, StorePredicate predicate) {
        Object actual = row.get(predicate.field());
        return switch (predicate.operator()) {
            case MATCH_NONE -> false;
            case IS_NULL -> actual == null;
            case IS_NOT_NULL -> actual != null;
            case NOT_EMPTY -> actual != null && !actual.toString().isEmpty();
            case HAS_ELEMENT -> actual instanceof Collection<?> elements
                    && elements.stream().anyMatch(element -> valueEquals(element, predicate.value()));
            case EQ -> anyElement(actual, element -> valueEquals(element, predicate.value()));
            case IN -> anyElement(actual, element -> predicate.values().stream().anyMatch(v -> valueEquals(element, v)));
            case GTE -> actual != null && compare(actual, predicate.value()) >= 0;
            case LTE -> actual != null && compare(actual, predicate.value()) <= 0;
            case LT -> actual != null && compare(actual, predicate.value()) < 0;
            case ILIKE -> likeMatches(actual, (String) predicate.value());
            case ANY_ILIKE -> predicate.fields().stream()
                    .anyMatch(field -> likeMatches(row.get(field), (String) predicate.value()));
        };
    }

    public boolean likeMatches(Object actual, String likePattern) {
        if (actual == null) {
            return false;
        }
        Pattern regex = patternCache.get(likePattern);
        return regex.matcher(actual.toString()).matches();
    }

    long cachedPatterns() {
        patternCache.cleanUp();
        return patternCache.estimatedSize();
    }

    static Pattern toRegex(String likePattern) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < likePattern.length(); i++) {
            char c = likePattern.charAt(i);
            if (c == LikeEscaper.ESCAPE && i + 1 < likePattern.length()) {
                literal.append(likePattern.charAt(++i));
            } else if (c == '%' || c == '_') {
                flushLiteral(regex, literal);
                regex.append(c == '%' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        flushLiteral(regex, literal);
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
    }

    private static void flushLiteral(StringBuilder regex, StringBuilder literal) {
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
            literal.setLength(0);
        }
    }

    private static boolean anyElement(Object actual, Predicate<Object> test) {
        if (actual instanceof Collection<?> collection) {
            return collection.stream().anyMatch(test);
        }
        return actual != null && test.test(actual);
    }

    private static boolean valueEquals(Object actual, Object expected) {
        if (actual instanceof Number a && expected instanceof Number e) {
            return new BigDecimal(a.toString()).compareTo(new BigDecimal(e.toString())) == 0;
        }
        return Objects.equals(String.valueOf(actual), String.valueOf(expected));
    }

    private static int compare(Object actual, Object bound) {
        if (actual instanceof Number && !(bound instanceof Number) && bound != null) {
            return new BigDecimal(actual.toString()).compareTo(new BigDecimal(bound.toString()));
        }
        return FilterCompiler.compare(actual, bound);
    }
}
