package org.studyhub.studyindex.client;

import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.http.HttpConnectTimeoutException;

/**
 * Classifies failures as transport-level (worth retrying) or logical (not).
 */
final class TransportFailures {

    private static final int MAX_CAUSE_DEPTH = 10;

    private TransportFailures() {
    }

    /**
     * Connection refused/reset, broken pipe, I/O timeouts and gateway-style 5xx answers.
     */
    static boolean isTransient(Throwable failure) {
        Throwable current = failure;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof ResourceAccessException
                    || current instanceof ConnectException
                    || current instanceof SocketException
                    || current instanceof HttpConnectTimeoutException
                    || current instanceof InterruptedIOException) {
                return true;
            }
            if (current instanceof HttpServerErrorException serverError) {
                int status = serverError.getStatusCode().value();
                return status == 502 || status == 503 || status == 504;
            }
            current = current.getCause();
        }
        return false;
    }
}
