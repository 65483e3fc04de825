package io.github.umputun.beacon;

import java.util.Objects;

/**
 * Position in the event stream, made of a server-assigned timetoken and region.
 * <p>
 * The timetoken is an unsigned 64-bit value; it is compared and printed unsigned.
 */
public final class Cursor implements Comparable<Cursor> {

    /** cursor meaning "start from now" */
    public static final Cursor START = new Cursor(0L, 0);

    private final long timetoken;
    private final int region;

    /**
     * Creates a new cursor.
     *
     * @param timetoken the timetoken, interpreted as unsigned
     * @param region    the region
     */
    public Cursor(long timetoken, int region) {
        this.timetoken = timetoken;
        this.region = region;
    }

    /**
     * Parses a cursor from its wire form, where the timetoken is a decimal string.
     *
     * @param timetoken decimal unsigned timetoken
     * @param region    the region
     * @return the cursor
     * @throws NumberFormatException if the timetoken is not an unsigned decimal
     */
    public static Cursor parse(String timetoken, int region) {
        return new Cursor(Long.parseUnsignedLong(timetoken), region);
    }

    /**
     * Returns the raw timetoken bits.
     *
     * @return the timetoken
     */
    public long getTimetoken() {
        return timetoken;
    }

    /**
     * Returns the region.
     *
     * @return the region
     */
    public int getRegion() {
        return region;
    }

    /**
     * Returns the timetoken as an unsigned decimal string.
     *
     * @return the timetoken string
     */
    public String timetokenString() {
        return Long.toUnsignedString(timetoken);
    }

    /**
     * Checks if this is the "start from now" cursor.
     *
     * @return true if timetoken and region are zero
     */
    public boolean isStart() {
        return timetoken == 0L && region == 0;
    }

    @Override
    public int compareTo(Cursor other) {
        int result = Long.compareUnsigned(timetoken, other.timetoken);
        return result != 0 ? result : Integer.compare(region, other.region);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Cursor cursor = (Cursor) o;
        return timetoken == cursor.timetoken && region == cursor.region;
    }

    @Override
    public int hashCode() {
        return Objects.hash(timetoken, region);
    }

    @Override
    public String toString() {
        return "Cursor{" +
                "timetoken=" + timetokenString() +
                ", region=" + region +
                '}';
    }
}
