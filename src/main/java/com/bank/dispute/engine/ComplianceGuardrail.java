package com.bank.dispute.engine;

import com.bank.dispute.exception.ComplianceViolationException;
import com.bank.dispute.model.GuardrailResult;
import com.bank.dispute.model.PatternKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stateless filter for payment card data in free text.
 *
 * Card numbers are found in digit runs of 13 or more digits, contiguous or
 * grouped by single spaces or dashes. Every run is judged by the same rule:
 * <ul>
 *   <li>a run of 13-19 digits that passes the Luhn checksum is a card number;</li>
 *   <li>a run of any length is also a card number when a 13-19 digit window at
 *       its start or its end passes Luhn, carries a known issuer prefix and has a
 *       length that issuer uses. This catches a card number glued to a reference
 *       or a stray digit on either side.</li>
 * </ul>
 * A card number buried in the middle of a longer run is not distinguishable from a
 * reference number and is not flagged; reference numbers of 20 or more digits are
 * only flagged when an end window looks like an issued card.
 *
 * Verification codes and PINs are only flagged when a short digit sequence
 * follows a labelling keyword.
 *
 * The same scan is used for inbound text (intake, evidence, audit detail) and
 * outbound text (responses echoing captured data). Matched spans are replaced by
 * a fixed mask; the original digits never leave this class.
 */
@Component
public class ComplianceGuardrail {

    private static final int MIN_PAN_DIGITS = 13;
    private static final int MAX_PAN_DIGITS = 19;

    // Contiguous digit runs
    private static final Pattern DIGIT_RUN = Pattern.compile("\\d{" + MIN_PAN_DIGITS + ",}");

    // Two or more digit groups joined by single spaces or dashes,
    // e.g. "4539 5787 6362 1486", "4539 578763621486" or "3782-822463-10005"
    private static final Pattern GROUPED_DIGITS = Pattern.compile("(?<!\\d)\\d{1,19}(?:[ -]\\d{1,19}){1,7}(?!\\d)");

    private static final List<IssuerRange> ISSUERS = List.of(
            new IssuerRange(4, 4, 1, Set.of(13, 16, 19)),          // Visa
            new IssuerRange(51, 55, 2, Set.of(16)),                // Mastercard
            new IssuerRange(2221, 2720, 4, Set.of(16)),            // Mastercard 2-series
            new IssuerRange(34, 34, 2, Set.of(15)),                // Amex
            new IssuerRange(37, 37, 2, Set.of(15)),
            new IssuerRange(6011, 6011, 4, Set.of(16, 19)),        // Discover
            new IssuerRange(644, 649, 3, Set.of(16, 19)),
            new IssuerRange(65, 65, 2, Set.of(16, 19)),
            new IssuerRange(3528, 3589, 4, Set.of(16, 19)),        // JCB
            new IssuerRange(300, 305, 3, Set.of(14)),              // Diners
            new IssuerRange(36, 36, 2, Set.of(14)),
            new IssuerRange(38, 39, 2, Set.of(16)),
            new IssuerRange(62, 62, 2, Set.of(16, 17, 18, 19)));   // UnionPay

    private static final Pattern CVV = Pattern.compile(
            "(?i)\\b(?:cvv2?|cvc2?|cid|csc|security\\s+code|verification\\s+code)\\b\\s*(?:is|:|=|#|-)?\\s*(\\d{3,4})(?!\\d)");

    private static final Pattern PIN = Pattern.compile(
            "(?i)\\bpin(?:\\s*(?:code|number|no\\.?))?\\b\\s*(?:is|:|=|#|-)?\\s*(\\d{4,6})(?!\\d)");

    public GuardrailResult scan(String text) {
        if (text == null || text.isEmpty()) {
            return GuardrailResult.builder()
                    .clean(true)
                    .redactedText(text)
                    .matches(Collections.emptyList())
                    .build();
        }

        List<Span> spans = new ArrayList<>();
        findCardNumbers(text, spans);
        findLabelled(text, CVV, PatternKind.CARD_VERIFICATION_CODE, spans);
        findLabelled(text, PIN, PatternKind.PIN, spans);

        if (spans.isEmpty()) {
            return GuardrailResult.builder()
                    .clean(true)
                    .redactedText(text)
                    .matches(Collections.emptyList())
                    .build();
        }

        Set<PatternKind> kinds = new LinkedHashSet<>();
        spans.forEach(s -> kinds.add(s.kind));

        return GuardrailResult.builder()
                .clean(false)
                .redactedText(redact(text, spans))
                .matches(List.copyOf(kinds))
                .build();
    }

    /**
     * Scan and fail with a {@link ComplianceViolationException} naming only the
     * categories detected.
     */
    public void requireClean(String disputeId, String field, String text) {
        GuardrailResult result = scan(text);
        if (!result.isClean()) {
            throw new ComplianceViolationException(disputeId, field, result.getMatches());
        }
    }

    /**
     * Returns the text unchanged when clean, otherwise its redacted form. Used
     * for outbound text where masking is preferable to refusing the response.
     */
    public String sanitize(String text) {
        return scan(text).getRedactedText();
    }

    static boolean luhnValid(CharSequence digits) {
        int sum = 0;
        boolean doubleIt = false;
        for (int i = digits.length() - 1; i >= 0; i--) {
            int d = digits.charAt(i) - '0';
            if (doubleIt) {
                d *= 2;
                if (d > 9) d -= 9;
            }
            sum += d;
            doubleIt = !doubleIt;
        }
        return sum % 10 == 0;
    }

    private void findCardNumbers(String text, List<Span> spans) {
        Matcher run = DIGIT_RUN.matcher(text);
        while (run.find()) {
            if (containsCardNumber(run.group())) {
                spans.add(new Span(run.start(), run.end(), PatternKind.CARD_NUMBER));
            }
        }

        Matcher grouped = GROUPED_DIGITS.matcher(text);
        while (grouped.find()) {
            String digits = grouped.group().replaceAll("[ -]", "");
            if (containsCardNumber(digits)) {
                spans.add(new Span(grouped.start(), grouped.end(), PatternKind.CARD_NUMBER));
            }
        }
    }

    static boolean containsCardNumber(String digits) {
        int len = digits.length();
        if (len < MIN_PAN_DIGITS) return false;
        if (len <= MAX_PAN_DIGITS && luhnValid(digits)) return true;
        for (int size = MIN_PAN_DIGITS; size <= Math.min(MAX_PAN_DIGITS, len); size++) {
            if (looksIssued(digits.substring(0, size)) || looksIssued(digits.substring(len - size))) {
                return true;
            }
        }
        return false;
    }

    private static boolean looksIssued(String window) {
        for (IssuerRange issuer : ISSUERS) {
            if (issuer.matches(window)) {
                return luhnValid(window);
            }
        }
        return false;
    }

    private static void findLabelled(String text, Pattern pattern, PatternKind kind, List<Span> spans) {
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            spans.add(new Span(m.start(1), m.end(1), kind));
        }
    }

    private static String redact(String text, List<Span> spans) {
        List<Span> ordered = new ArrayList<>(spans);
        ordered.sort(Comparator.comparingInt((Span s) -> s.start).thenComparingInt(s -> -s.end));

        StringBuilder out = new StringBuilder(text.length());
        int cursor = 0;
        for (Span span : ordered) {
            if (span.end <= cursor) continue;           // fully inside an earlier mask
            int from = Math.max(span.start, cursor);
            out.append(text, cursor, from);
            out.append(span.kind.getMask());
            cursor = span.end;
        }
        out.append(text, cursor, text.length());
        return out.toString();
    }

    private record Span(int start, int end, PatternKind kind) {}

    private record IssuerRange(int low, int high, int prefixDigits, Set<Integer> lengths) {

        boolean matches(String window) {
            if (!lengths.contains(window.length())) return false;
            int prefix = Integer.parseInt(window.substring(0, prefixDigits));
            return prefix >= low && prefix <= high;
        }
    }
}
