package alpha.nomagicdispatch;

import alpha.nomagicdispatch.message.Response;

/**
 * Namespace of constants related to the HTTP protocol.<p>
 *
 * Only what the engine and its bundled middleware actually use is declared
 * here. Any other status code or header name is of course still legal to set
 * on a {@link Response}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class HttpConstants {
    private HttpConstants() {
        // Empty
    }

    /**
     * HTTP methods a route can be registered for.<p>
     *
     * The set is closed. A request carrying any other method token (HEAD,
     * OPTIONS, ...) will pass through middleware as usual, but it can never
     * match a route.
     */
    public enum Method {
        /** Safe? Yes. Idempotent? Yes. Response cacheable? Yes. */
        GET,
        /** Safe? No. Idempotent? No. Response cacheable? Yes. */
        POST,
        /** Safe? No. Idempotent? Yes. Response cacheable? No. */
        PUT,
        /** Safe? No. Idempotent? Yes. Response cacheable? No. */
        DELETE,
        /** Safe? No. Idempotent? No. Response cacheable? No. */
        PATCH;

        /**
         * Returns the constant whose name is equal to the given token.<p>
         *
         * Method tokens are case-sensitive (
         * <a href="https://tools.ietf.org/html/rfc7231#section-4.1">RFC 7231 §4.1</a>
         * ), "get" is not the same method as "GET".
         *
         * @param token method token from the request line
         * @return the method, or {@code null} if there is no such constant
         */
        public static Method ofToken(String token) {
            for (Method m : values()) {
                if (m.name().equals(token)) {
                    return m;
                }
            }
            return null;
        }
    }

    /**
     * Status codes used by the engine and the bundled middleware.
     */
    public static final class StatusCode {
        private StatusCode() {
            // Private
        }

        /** {@value} {@value ReasonPhrase#OK}. The default of a response. */
        public static final int TWO_HUNDRED = 200;

        /** {@value} {@value ReasonPhrase#CREATED}. */
        public static final int TWO_HUNDRED_ONE = 201;

        /** {@value} {@value ReasonPhrase#FOUND}. Used by redirects. */
        public static final int THREE_HUNDRED_TWO = 302;

        /**
         * {@value} {@value ReasonPhrase#NOT_FOUND}.<p>
         *
         * Sent when the dispatch completed without anyone writing the response.
         */
        public static final int FOUR_HUNDRED_FOUR = 404;

        /** {@value} {@value ReasonPhrase#ENTITY_TOO_LARGE}. */
        public static final int FOUR_HUNDRED_THIRTEEN = 413;

        /**
         * {@value} {@value ReasonPhrase#INTERNAL_SERVER_ERROR}.<p>
         *
         * Sent when an error was not handled by any error handler, or an
         * exception escaped a handler.
         */
        public static final int FIVE_HUNDRED = 500;

        /** {@value} {@value ReasonPhrase#SERVICE_UNAVAILABLE}. */
        public static final int FIVE_HUNDRED_THREE = 503;
    }

    /**
     * Reason phrases, also used as the plain-text body of fallback responses.
     */
    public static final class ReasonPhrase {
        private ReasonPhrase() {
            // Private
        }

        /** Goes with status code {@value StatusCode#TWO_HUNDRED}. */
        public static final String OK = "OK";

        /** Goes with status code {@value StatusCode#TWO_HUNDRED_ONE}. */
        public static final String CREATED = "Created";

        /** Goes with status code {@value StatusCode#THREE_HUNDRED_TWO}. */
        public static final String FOUND = "Found";

        /** Goes with status code {@value StatusCode#FOUR_HUNDRED_FOUR}. */
        public static final String NOT_FOUND = "Not Found";

        /** Goes with status code {@value StatusCode#FOUR_HUNDRED_THIRTEEN}. */
        public static final String ENTITY_TOO_LARGE = "Entity Too Large";

        /** Goes with status code {@value StatusCode#FIVE_HUNDRED}. */
        public static final String INTERNAL_SERVER_ERROR = "Internal Server Error";

        /** Goes with status code {@value StatusCode#FIVE_HUNDRED_THREE}. */
        public static final String SERVICE_UNAVAILABLE = "Service Unavailable";
    }

    /**
     * Header names.<p>
     *
     * Header names are case-insensitive. The values declared here use the
     * capitalization of the RFCs.
     */
    public static final class HeaderKey {
        private HeaderKey() {
            // Private
        }

        /** The media type of the message body. */
        public static final String CONTENT_TYPE = "Content-Type";

        /** The byte count of the message body. */
        public static final String CONTENT_LENGTH = "Content-Length";

        /** Target of a redirect. */
        public static final String LOCATION = "Location";

        /** Required by HTTP/1.1 requests, used to rebuild absolute URLs. */
        public static final String HOST = "Host";
    }
}
