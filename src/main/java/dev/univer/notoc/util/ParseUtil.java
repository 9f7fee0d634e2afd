package dev.univer.notoc.util;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class ParseUtil {
    // "50000", "50.5", "20,5", "50k", "1.5k"
    private static final Pattern AMOUNT = Pattern.compile("^(?<num>\\d+(?:[\\.,]\\d{1,2})?)(?<k>[kK])?$");
    private static final Pattern ISO_START = Pattern.compile("^\\d{4}-");
    private static final DateTimeFormatter DATE_DOTS = DateTimeFormatter.ofPattern("dd.MM.yyyy");

    /** Name, amount and optional note taken from command arguments. */
    public static class NameAmountNote {
        public final String name;
        public final BigDecimal amount;
        public final String note; // may be null
        public NameAmountNote(String name, BigDecimal amount, String note) {
            this.name = name;
            this.amount = amount;
            this.note = (note == null || note.isBlank()) ? null : note.trim();
        }
    }

    /** Positive amount with an optional "k" (thousands) suffix, or null. */
    public static BigDecimal parseAmount(String raw) {
        if (raw == null) return null;
        Matcher m = AMOUNT.matcher(raw.trim());
        if (!m.matches()) return null;
        BigDecimal v = new BigDecimal(m.group("num").replace(',', '.'));
        if (m.group("k") != null) v = v.multiply(BigDecimal.valueOf(1000));
        return v.signum() > 0 ? v : null;
    }

    /**
     * "/add Khanh Duy 50k coffee" style arguments: the first token after the name that looks like
     * an amount splits the name from the note. Null when there is no name or no amount.
     */
    public static NameAmountNote parseNameAmountNote(String[] args) {
        for (int i = 1; i < args.length; i++) {
            BigDecimal amount = parseAmount(args[i]);
            if (amount != null) {
                String name = String.join(" ", Arrays.copyOfRange(args, 0, i)).trim();
                String note = String.join(" ", Arrays.copyOfRange(args, i + 1, args.length));
                return name.isEmpty() ? null : new NameAmountNote(name, amount, note);
            }
        }
        return null;
    }

    /** "50k coffee": amount first, no name (the debtor is known from elsewhere). Null without an amount. */
    public static NameAmountNote parseAmountNote(String[] args) {
        if (args.length == 0) return null;
        BigDecimal amount = parseAmount(args[0]);
        if (amount == null) return null;
        return new NameAmountNote(null, amount, String.join(" ", Arrays.copyOfRange(args, 1, args.length)));
    }

    /** YYYY-MM-DD, or DD.MM.YYYY with '.', '/' or '-' between parts; null otherwise. */
    public static LocalDate parseFlexibleDate(String raw) {
        if (raw == null) return null;
        String s = raw.trim();
        try {
            if (ISO_START.matcher(s).lookingAt()) {
                return LocalDate.parse(s); // ISO
            } else {
                return LocalDate.parse(s.replace('/', '.').replace('-', '.'), DATE_DOTS);
            }
        } catch (DateTimeParseException e) { return null; }
    }

    /** Deadlines are kept as instants; a date means its start in UTC. */
    public static Instant startOfDayUtc(LocalDate date) {
        return date.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    public static String fmtMoney(BigDecimal x) {
        return x.stripTrailingZeros().toPlainString();
    }
}
