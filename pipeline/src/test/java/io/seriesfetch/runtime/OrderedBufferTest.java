package io.seriesfetch.runtime;

import io.seriesfetch.core.Sequenced;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OrderedBufferTest {
    @Test
    void releases_in_seq_order_regardless_of_arrival() {
        OrderedBuffer<String> buf = new OrderedBuffer<>(0);
        buf.add(new Sequenced<>(2, "c"));
        buf.add(new Sequenced<>(1, "b"));
        assertNull(buf.pollNext(), "seq 0 has not arrived");
        assertEquals(2, buf.pending());

        buf.add(new Sequenced<>(0, "a"));
        assertEquals(List.of("a", "b", "c"), buf.drainReady());
        assertEquals(3, buf.nextSeq());
        assertEquals(0, buf.pending());
    }

    @Test
    void rejects_duplicate_seq() {
        OrderedBuffer<String> buf = new OrderedBuffer<>(0);
        buf.add(new Sequenced<>(1, "x"));
        assertThrows(IllegalStateException.class, () -> buf.add(new Sequenced<>(1, "y")));
        buf.add(new Sequenced<>(0, "w"));
        buf.drainReady();
        assertThrows(IllegalStateException.class, () -> buf.add(new Sequenced<>(0, "again")));
    }
}
