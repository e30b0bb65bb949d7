package com.aino.routing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A compiled route path: an ordered list of literal and named segments.
 */
public class PathPattern {
    private final String path;
    private final List<Segment> segments;

    private PathPattern(String path, List<Segment> segments) {
        this.path = path;
        this.segments = Collections.unmodifiableList(segments);
    }

    /**
     * Compiles a route path. The path is split on {@code /}, empty segments are dropped and
     * segments starting with {@code :} become named parameters.
     *
     * @param path the route path, e.g. "/orders/:id"
     * @return the compiled pattern
     */
    public static PathPattern compile(String path) {
        List<Segment> segments = new ArrayList<>();
        if (path != null) {
            for (String part : path.split("/")) {
                if (part.isEmpty()) {
                    continue;
                }
                if (part.startsWith(":")) {
                    String name = part.substring(1);
                    if (name.isEmpty()) {
                        throw new IllegalArgumentException("Unnamed parameter in route path: " + path);
                    }
                    segments.add(Segment.param(name));
                } else {
                    segments.add(Segment.literal(part));
                }
            }
        }
        return new PathPattern(path, segments);
    }

    /**
     * Gets the path this pattern was compiled from.
     *
     * @return the original path
     */
    public String getPath() {
        return path;
    }

    public List<Segment> getSegments() {
        return segments;
    }

    /**
     * Gets the names of the parameter segments, in order.
     *
     * @return the parameter names
     */
    public List<String> getParamNames() {
        List<String> names = new ArrayList<>();
        for (Segment segment : segments) {
            if (segment.isParam()) {
                names.add(segment.getValue());
            }
        }
        return names;
    }

    /**
     * Matches request path segments against this pattern.
     *
     * <p>Segment counts must be equal. A named segment binds whatever request segment is in its
     * position; a literal segment must equal it exactly, case-sensitively.</p>
     *
     * @param requestSegments the request path segments
     * @return the bound parameters, or null if the path does not match
     */
    public Map<String, String> match(List<String> requestSegments) {
        if (requestSegments.size() != segments.size()) {
            return null;
        }

        Map<String, String> params = new HashMap<>();
        for (int i = 0; i < segments.size(); i++) {
            Segment segment = segments.get(i);
            String value = requestSegments.get(i);
            if (segment.isParam()) {
                params.put(segment.getValue(), value);
            } else if (!segment.getValue().equals(value)) {
                return null;
            }
        }
        return params;
    }

    @Override
    public String toString() {
        return path;
    }

    /** One segment of a route path. */
    public static final class Segment {
        private final String value;
        private final boolean param;

        private Segment(String value, boolean param) {
            this.value = value;
            this.param = param;
        }

        static Segment literal(String value) {
            return new Segment(value, false);
        }

        static Segment param(String name) {
            return new Segment(name, true);
        }

        /**
         * Gets the literal text, or the parameter name for named segments.
         *
         * @return the value
         */
        public String getValue() {
            return value;
        }

        public boolean isParam() {
            return param;
        }

        @Override
        public String toString() {
            return param ? ":" + value : value;
        }
    }
}
