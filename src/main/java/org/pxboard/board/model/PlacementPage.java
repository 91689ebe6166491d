package org.pxboard.board.model;

import java.util.List;

/**
 * One page of a placement listing.
 *
 * @param items Placements ordered by timestamp, then id.
 * @param next  Cursor of the following page, or {@code null} if this is the last one.
 */
public record PlacementPage(List<Placement> items, Cursor next) {

    /**
     * Position in the listing: everything after {@code (timestamp, id)}.
     */
    public record Cursor(int timestamp, long id) {

        public static final Cursor START = new Cursor(0, 0);

        public static Cursor after(final Placement placement) {
            return new Cursor(placement.timestamp(), placement.id());
        }

        /**
         * Parses the {@code timestamp_id} token form.
         *
         * @throws IllegalArgumentException if the token is malformed.
         */
        public static Cursor parse(final String token) {
            final int separator = token.indexOf('_');
            if (separator < 0) {
                throw new IllegalArgumentException("Page token '" + token + "' is malformed");
            }
            try {
                final int timestamp = Integer.parseInt(token.substring(0, separator));
                final long id = Long.parseLong(token.substring(separator + 1));
                if (timestamp < 0 || id < 0) {
                    throw new IllegalArgumentException("Page token '" + token + "' is malformed");
                }
                return new Cursor(timestamp, id);
            } catch (final NumberFormatException e) {
                throw new IllegalArgumentException("Page token '" + token + "' is malformed");
            }
        }

        @Override
        public String toString() {
            return timestamp + "_" + id;
        }
    }
}
