package com.trueform.client.transport;

import java.io.IOException;
import java.time.Duration;

/**
 * Nothing arrived before the read deadline. The connection is still usable.
 */
public class ReadTimeoutException extends IOException {

    public ReadTimeoutException(Duration deadline) {
        super("no frame within " + deadline.toMillis() + "ms");
    }
}
