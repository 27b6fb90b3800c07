package io.github.drompincen.pledgebook.runtime.registry;

/**
 * Field-level predicates applied before any registry write. All of them are total:
 * they never throw, whatever the input.
 */
public final class RegistryValidation {

    public static final int MAX_DESCRIPTION_LENGTH = 100;
    public static final int MIN_URGENCY = 1;
    public static final int MAX_URGENCY = 3;

    private RegistryValidation() {}

    public static boolean isNonEmpty(String text) {
        return text != null && !text.isEmpty();
    }

    /** Length is counted in code points, so a surrogate pair is one character. */
    public static boolean fitsDescription(String text) {
        return text != null && text.codePointCount(0, text.length()) <= MAX_DESCRIPTION_LENGTH;
    }

    public static boolean isValidDescription(String text) {
        return isNonEmpty(text) && fitsDescription(text);
    }

    public static boolean isValidAddress(String address) {
        return address != null && !address.isBlank();
    }

    public static boolean isValidPriority(int urgency) {
        return urgency >= MIN_URGENCY && urgency <= MAX_URGENCY;
    }

    public static boolean isValidOffset(long offset) {
        return offset > 0;
    }

    /** A positive offset whose target point {@code current + offset} does not overflow. */
    public static boolean isValidOffset(long offset, long current) {
        return isValidOffset(offset) && offset <= Long.MAX_VALUE - current;
    }
}
