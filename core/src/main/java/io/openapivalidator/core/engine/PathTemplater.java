package io.openapivalidator.core.engine;

import io.openapivalidator.core.error.RequestValidationException;
import io.openapivalidator.core.model.IncomingRequest;
import io.openapivalidator.core.model.OperationLocator;
import io.openapivalidator.core.spec.JsonPointers;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a concrete request path back into the templated path key of the OpenAPI document:
 * {@code /users/123} with path parameter {@code id=123} becomes {@code /users/{id}}.
 *
 * <p>
 * Each routed path parameter replaces one occurrence of its value with {@code {name}}. Values
 * only match whole path segments (bounded by {@code /}, {@code .} or the ends of the path), and
 * parameters are substituted one after another, scanning left to right from the previous
 * substitution. Two parameters sharing a value therefore land on their own segments instead of
 * both claiming the first one. The substitution order is the declared order passed to
 * {@link #template(IncomingRequest, List)}; parameters it does not name follow in the order the
 * router reports them. Routing-internal keys never take part. Segments without a parameter stay
 * literal; there is no fuzzy matching against the document's path keys.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class PathTemplater {

    private static final Logger LOG = LoggerFactory.getLogger(PathTemplater.class);

    /** Router bookkeeping keys that identify the handler rather than a URL segment. */
    public static final Set<String> DEFAULT_ROUTING_KEYS = Set.of("controller", "action");

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^}/]+)}");

    private final Set<String> routingKeys;

    public PathTemplater() {
        this(DEFAULT_ROUTING_KEYS);
    }

    public PathTemplater(Set<String> routingKeys) {
        this.routingKeys = Set.copyOf(Objects.requireNonNull(routingKeys, "routingKeys must not be null"));
    }

    /** Locates the operation for {@code request}: templated path plus lowercase verb. */
    public OperationLocator locate(IncomingRequest request) {
        return new OperationLocator(template(request), request.method());
    }

    /**
     * Returns the pointer-safe templated path, e.g. {@code ~1users~1{id}}.
     *
     * @throws RequestValidationException if the path contains a malformed percent-escape
     */
    public String templatePath(IncomingRequest request) {
        return JsonPointers.escape(template(request));
    }

    /**
     * Returns the templated path, e.g. {@code /users/{id}}.
     *
     * @throws RequestValidationException if the path contains a malformed percent-escape
     */
    public String template(IncomingRequest request) {
        return template(request, List.of());
    }

    /**
     * Returns the templated path, substituting the parameters named in {@code declaredOrder}
     * first and in that order.
     *
     * @throws RequestValidationException if the path contains a malformed percent-escape
     */
    public String template(IncomingRequest request, List<String> declaredOrder) {
        String path = decode(request.path());
        Map<String, String> routed = substitutable(request);
        Set<String> order = new LinkedHashSet<>(declaredOrder);
        order.retainAll(routed.keySet());
        order.addAll(routed.keySet());
        String templated = path;
        int cursor = 0;
        for (String name : order) {
            String value = routed.get(name);
            int index = indexOfSegment(templated, value, cursor);
            if (index < 0) {
                index = indexOfSegment(templated, value, 0);
            }
            if (index < 0) {
                LOG.debug("Path parameter '{}' value '{}' does not appear in {}", name, value, path);
                continue;
            }
            String placeholder = "{" + name + "}";
            templated = templated.substring(0, index) + placeholder + templated.substring(index + value.length());
            cursor = index + placeholder.length();
        }
        LOG.debug("Templated {} as {}", path, templated);
        return templated;
    }

    /** True when two substitutable path parameters carry the same value, so their order matters. */
    public boolean hasSharedValues(IncomingRequest request) {
        Collection<String> values = substitutable(request).values();
        return new HashSet<>(values).size() < values.size();
    }

    /** Names of the path parameters that take part in substitution, in router order. */
    public Set<String> substitutableNames(IncomingRequest request) {
        return substitutable(request).keySet();
    }

    /** The {@code {name}} placeholders of an OpenAPI path key, in order of appearance. */
    static List<String> placeholders(String pathKey) {
        List<String> names = new ArrayList<>();
        Matcher matcher = PLACEHOLDER.matcher(pathKey);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    private Map<String, String> substitutable(IncomingRequest request) {
        Map<String, String> routed = new LinkedHashMap<>();
        request.pathParameters().forEach((name, value) -> {
            if (!routingKeys.contains(name) && value != null && !value.isEmpty()) {
                routed.put(name, value);
            }
        });
        return routed;
    }

    /** Percent-decodes a raw path. A literal {@code +} stays a plus and a decoded space becomes one too. */
    static String decode(String rawPath) {
        try {
            return URLDecoder.decode(rawPath, StandardCharsets.UTF_8).replace(' ', '+');
        } catch (IllegalArgumentException e) {
            throw new RequestValidationException("Malformed request path: " + rawPath, e);
        }
    }

    private static int indexOfSegment(String text, String value, int from) {
        int index = text.indexOf(value, from);
        while (index >= 0) {
            int end = index + value.length();
            if ((index == 0 || isBoundary(text.charAt(index - 1)))
                    && (end == text.length() || isBoundary(text.charAt(end)))) {
                return index;
            }
            index = text.indexOf(value, index + 1);
        }
        return -1;
    }

    private static boolean isBoundary(char c) {
        return c == '/' || c == '.';
    }
}
