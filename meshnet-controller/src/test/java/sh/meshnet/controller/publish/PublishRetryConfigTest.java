// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.controller.publish;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class PublishRetryConfigTest {

    @Test
    void defaultsMatchConstants() {
        final PublishRetryConfig config = PublishRetryConfig.defaults();
        assertEquals(3, config.maxAttempts());
        assertEquals(200, config.backoffBaseMs());
        assertEquals(5000, config.backoffMaxMs());
    }

    @Test
    void backoffDoublesAndCaps() {
        final PublishRetryConfig config = PublishRetryConfig.defaults();
        assertEquals(200, config.backoffMillis(1, 0.0));
        assertEquals(400, config.backoffMillis(2, 0.0));
        assertEquals(800, config.backoffMillis(3, 0.0));
        assertEquals(5000, config.backoffMillis(10, 0.0));
        assertEquals(5000, config.backoffMillis(100, 0.0));
        assertEquals(250, config.backoffMillis(1, 0.25));
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> PublishRetryConfig.builder().maxAttempts(0).build());
        assertThrows(IllegalArgumentException.class, () -> PublishRetryConfig.builder().backoffBaseMs(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> PublishRetryConfig.builder().backoffBaseMs(100).backoffMaxMs(50).build());
        assertThrows(IllegalArgumentException.class,
                () -> PublishRetryConfig.builder().jitterMin(0.3).jitterMax(0.2).build());
    }
}
