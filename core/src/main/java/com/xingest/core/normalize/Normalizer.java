package com.xingest.core.normalize;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 원시 문자열 → 타입 값 변환(순수 함수).
 * - 어떤 입력에도 예외를 던지지 않는다(실패는 0 / empty 로 열화)
 */
public final class Normalizer {

    private Normalizer() {}

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1_000L);
    private static final BigDecimal MILLION = BigDecimal.valueOf(1_000_000L);
    private static final BigDecimal BILLION = BigDecimal.valueOf(1_000_000_000L);

    private static final String JOINED_PREFIX = "Joined ";
    private static final Pattern RELATIVE = Pattern.compile("^(\\d+)([smhd])$", Pattern.CASE_INSENSITIVE);

    private static final DateTimeFormatter MONTH_YEAR_FULL = caseInsensitive("MMMM uuuu");
    private static final DateTimeFormatter MONTH_YEAR_SHORT = caseInsensitive("MMM uuuu");
    private static final DateTimeFormatter MONTH_DAY_YEAR = caseInsensitive("MMM d, uuuu");

    private static DateTimeFormatter caseInsensitive(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH);
    }

    // ---------- counts ----------

    /**
     * "1.2K" → 1200, "1M" → 1000000, "1,234" → 1234.
     * 접미사 배수 적용 후 0 방향 절삭. 빈/해석불가 입력은 0, 음수는 0으로 클램프.
     */
    public static long normalizeCount(String raw) {
        if (raw == null) return 0L;
        String s = raw.replace(",", "").replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
        if (s.isEmpty()) return 0L;

        BigDecimal multiplier;
        switch (s.charAt(s.length() - 1)) {
            case 'K': multiplier = THOUSAND; break;
            case 'M': multiplier = MILLION; break;
            case 'B': multiplier = BILLION; break;
            default:  multiplier = null;
        }
        if (multiplier != null) s = s.substring(0, s.length() - 1);
        else multiplier = BigDecimal.ONE;

        try {
            BigDecimal v = new BigDecimal(s).multiply(multiplier).setScale(0, RoundingMode.DOWN);
            if (v.signum() < 0) return 0L;
            return v.longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            return 0L;
        }
    }

    // ---------- joined date ----------

    /** "Joined March 2009" → 2009-03. 전체 월 이름 → 약어 순으로 시도. */
    public static Optional<YearMonth> parseJoinedDate(String raw) {
        if (raw == null) return Optional.empty();
        String s = raw.replace(JOINED_PREFIX, "").trim();
        if (s.isEmpty()) return Optional.empty();

        for (DateTimeFormatter f : new DateTimeFormatter[]{MONTH_YEAR_FULL, MONTH_YEAR_SHORT}) {
            try {
                return Optional.of(YearMonth.parse(s, f));
            } catch (DateTimeParseException ignore) {
                // 다음 포맷 시도
            }
        }
        return Optional.empty();
    }

    // ---------- post timestamps ----------

    /** 현재 시각 기준. 상대 표기("2h")는 호출 시점마다 결과가 달라진다(비멱등). */
    public static Optional<Instant> parsePostTimestamp(String raw) {
        return parsePostTimestamp(raw, ZonedDateTime.now(ZoneId.of("UTC")));
    }

    /**
     * 시도 순서:
     * 1) ISO-8601 + 존 접미사("2026-01-18T18:17:20.000Z")
     * 2) 상대 오프셋 "&lt;n&gt;s|m|h|d": reference 기준, 초 단위는 reference 로 수렴
     * 3) "Mon D, YYYY"
     * 4) "Mon D": reference 의 연도 사용
     * 달력 표기는 reference 존의 자정으로 해석한다.
     */
    public static Optional<Instant> parsePostTimestamp(String raw, ZonedDateTime reference) {
        if (raw == null) return Optional.empty();
        String s = raw.trim();
        if (s.isEmpty()) return Optional.empty();

        // 1) ISO-8601
        if (s.indexOf('T') > 0 && (s.endsWith("Z") || s.endsWith("z") || s.contains("+") || s.lastIndexOf('-') > s.indexOf('T'))) {
            try {
                return Optional.of(OffsetDateTime.parse(s.replace('z', 'Z'), DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant());
            } catch (DateTimeParseException ignore) {
                // 상대/달력 표기로 계속
            }
        }

        // 2) 상대 오프셋
        Matcher m = RELATIVE.matcher(s);
        if (m.matches()) {
            long n;
            try {
                n = Long.parseLong(m.group(1));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
            Instant ref = reference.toInstant();
            try {
                switch (Character.toLowerCase(m.group(2).charAt(0))) {
                    case 's': return Optional.of(ref.truncatedTo(ChronoUnit.SECONDS));
                    case 'm': return Optional.of(ref.minus(n, ChronoUnit.MINUTES));
                    case 'h': return Optional.of(ref.minus(n, ChronoUnit.HOURS));
                    default:  return Optional.of(ref.minus(n, ChronoUnit.DAYS));
                }
            } catch (DateTimeException | ArithmeticException e) {
                // Instant 범위를 벗어나는 오프셋
                return Optional.empty();
            }
        }

        ZoneId zone = reference.getZone();

        // 3) "Mon D, YYYY"
        try {
            return Optional.of(LocalDate.parse(s, MONTH_DAY_YEAR).atStartOfDay(zone).toInstant());
        } catch (DateTimeParseException ignore) {
            // 연도 없는 표기로 계속
        }

        // 4) "Mon D" (reference 연도)
        try {
            DateTimeFormatter monthDay = new DateTimeFormatterBuilder()
                    .parseCaseInsensitive()
                    .appendPattern("MMM d")
                    .parseDefaulting(ChronoField.YEAR, reference.getYear())
                    .toFormatter(Locale.ENGLISH);
            return Optional.of(LocalDate.parse(s, monthDay).atStartOfDay(zone).toInstant());
        } catch (DateTimeException ignore) {
            return Optional.empty();
        }
    }
}
