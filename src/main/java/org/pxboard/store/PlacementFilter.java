package org.pxboard.store;

/**
 * Restricts a placement listing. Every range bound is inclusive; a {@code null} bound or user
 * matches anything.
 *
 * @param position  Pixel positions to include.
 * @param color     Colors to include.
 * @param timestamp Placement timestamps to include.
 * @param userId    Only placements of this user, if set.
 */
public record PlacementFilter(Range position, Range color, Range timestamp, String userId) {

    public static final PlacementFilter NONE = new PlacementFilter(Range.OPEN, Range.OPEN, Range.OPEN, null);

    public PlacementFilter {
        position = position == null ? Range.OPEN : position;
        color = color == null ? Range.OPEN : color;
        timestamp = timestamp == null ? Range.OPEN : timestamp;
    }

    /**
     * An inclusive range of non-negative values.
     */
    public record Range(Long min, Long max) {

        public static final Range OPEN = new Range(null, null);

        public static Range exactly(final long value) {
            return new Range(value, value);
        }

        public boolean isOpen() {
            return min == null && max == null;
        }

        /**
         * Parses {@code a..b}, {@code a..}, {@code ..b}, {@code ..} or a single value {@code n}.
         * Both bounds are inclusive.
         *
         * @throws IllegalArgumentException if the text is not a range of non-negative integers.
         */
        public static Range parse(final String text) {
            final String value = text.trim();
            final int dots = value.indexOf("..");
            if (dots < 0) {
                return exactly(bound(value, text));
            }
            final String first = value.substring(0, dots);
            final String last = value.substring(dots + 2);
            return new Range(first.isEmpty() ? null : bound(first, text), last.isEmpty() ? null : bound(last, text));
        }

        private static long bound(final String value, final String text) {
            try {
                final long parsed = Long.parseLong(value.trim());
                if (parsed < 0) {
                    throw new IllegalArgumentException("Range '" + text + "' has a negative bound");
                }
                return parsed;
            } catch (final NumberFormatException e) {
                throw new IllegalArgumentException("'" + text + "' is not a range");
            }
        }

        /**
         * The text form accepted by {@link #parse(String)}.
         */
        @Override
        public String toString() {
            if (min != null && min.equals(max)) {
                return String.valueOf(min);
            }
            return (min == null ? "" : String.valueOf(min)) + ".." + (max == null ? "" : String.valueOf(max));
        }
    }
}
