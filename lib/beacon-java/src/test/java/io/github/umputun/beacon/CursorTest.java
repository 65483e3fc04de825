package io.github.umputun.beacon;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CursorTest {

    @Test
    void parseKeepsFullTimetoken() {
        Cursor cursor = Cursor.parse("17000000000000000", 4);

        assertThat(cursor.getTimetoken()).isEqualTo(17000000000000000L);
        assertThat(cursor.getRegion()).isEqualTo(4);
        assertThat(cursor.timetokenString()).isEqualTo("17000000000000000");
        assertThat(cursor.isStart()).isFalse();
    }

    @Test
    void timetokenIsUnsigned() {
        Cursor big = Cursor.parse("18446744073709551615", 1);
        Cursor small = Cursor.parse("1", 1);

        assertThat(big.timetokenString()).isEqualTo("18446744073709551615");
        assertThat(big).isGreaterThan(small);
    }

    @Test
    void regionBreaksTies() {
        assertThat(new Cursor(5, 2)).isGreaterThan(new Cursor(5, 1));
        assertThat(new Cursor(5, 1)).isEqualByComparingTo(new Cursor(5, 1));
    }

    @Test
    void start() {
        assertThat(Cursor.START.isStart()).isTrue();
        assertThat(Cursor.START.timetokenString()).isEqualTo("0");
        assertThat(new Cursor(0, 3).isStart()).isFalse();
    }

    @Test
    void parseRejectsGarbage() {
        assertThatThrownBy(() -> Cursor.parse("-1", 0)).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> Cursor.parse("abc", 0)).isInstanceOf(NumberFormatException.class);
    }

    @Test
    void equalsAndHashCode() {
        assertThat(new Cursor(10, 1)).isEqualTo(new Cursor(10, 1));
        assertThat(new Cursor(10, 1).hashCode()).isEqualTo(new Cursor(10, 1).hashCode());
        assertThat(new Cursor(10, 1)).isNotEqualTo(new Cursor(10, 2));
        assertThat(new Cursor(10, 1).toString()).contains("timetoken=10").contains("region=1");
    }
}
