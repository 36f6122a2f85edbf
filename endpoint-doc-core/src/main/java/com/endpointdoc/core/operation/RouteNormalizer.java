package com.endpointdoc.core.operation;

import com.endpointdoc.core.config.DocumentOptions;
import com.endpointdoc.core.config.TagCase;
import com.endpointdoc.core.model.EndpointDefinition;
import com.endpointdoc.core.model.WireType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Route template rewriting: constraint stripping, bare routes and tag derivation.
 */
public final class RouteNormalizer {

    private static final Pattern CONSTRAINT = Pattern.compile("(?<=\\{)([^?:}]+)[^}]*(?=})");
    private static final Pattern ROUTE_PARAM = Pattern.compile("(?<=\\{)[^{}]*(?=})");
    private static final Pattern CONSTRAINED_SEGMENT = Pattern.compile("\\{[^{}]*:[^{}]*}");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-zA-Z0-9]");

    private RouteNormalizer() {
        // Utility class
    }

    /**
     * Reduces every {@code {name:constraint(args)}} token to {@code {name}}.
     *
     * @param route route template
     * @return route without constraints
     */
    public static String stripRouteConstraints(String route) {
        String[] parts = route.split("/", -1);
        for (int i = 0; i < parts.length; i++) {
            parts[i] = CONSTRAINT.matcher(parts[i]).replaceAll("$1");
        }
        return String.join("/", parts);
    }

    /**
     * Computes the canonical operation path of a route template.
     *
     * @param routeTemplate template as registered, e.g. {@code ~/api/orders/{id:int}/}
     * @return path such as {@code /api/orders/{id}}
     */
    public static String canonicalPath(String routeTemplate) {
        String trimmed = routeTemplate;
        while (trimmed.startsWith("~") || trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return "/" + stripRouteConstraints(trimmed);
    }

    /**
     * Removes the global route prefix and the version segment from a canonical path.
     *
     * @param path canonical path
     * @param currentVersion current endpoint version
     * @param options documentation policy
     * @return bare route
     */
    public static String bareRoute(String path, int currentVersion, DocumentOptions options) {
        String routePrefix = "/" + (options.endpointRoutePrefix() != null ? options.endpointRoutePrefix() : "_");
        String version = "/" + options.versioningPrefix() + currentVersion;
        return path.replace(routePrefix, "").replace(version, "");
    }

    /**
     * Derives the tag of an operation.
     *
     * @param bareRoute bare route of the operation
     * @param definition endpoint definition
     * @param options documentation policy
     * @return tag, or empty when auto-tagging is off or the route is too short
     */
    public static Optional<String> deriveTag(String bareRoute, EndpointDefinition definition, DocumentOptions options) {
        int index = options.autoTagPathSegmentIndex();
        if (index <= 0 || definition.dontAutoTag()) {
            return Optional.empty();
        }
        if (definition.tagOverride() != null) {
            return Optional.of(tagName(definition.tagOverride(), options.tagCase(), options.tagStripSymbols()));
        }
        String[] segments = Arrays.stream(bareRoute.split("/"))
            .filter(s -> !s.isEmpty())
            .toArray(String[]::new);
        if (segments.length < index) {
            return Optional.empty();
        }
        return Optional.of(tagName(segments[index - 1], options.tagCase(), options.tagStripSymbols()));
    }

    /**
     * Applies the case transform and symbol stripping to a tag.
     *
     * @param input raw tag
     * @param tagCase case transform
     * @param stripSymbols whether non-alphanumeric characters are removed
     * @return tag name
     */
    public static String tagName(String input, TagCase tagCase, boolean stripSymbols) {
        String cased = switch (tagCase) {
            case NONE -> input;
            case TITLE_CASE -> toTitleCase(input);
            case LOWER_CASE -> input.toLowerCase(Locale.ROOT);
        };
        return stripSymbols ? NON_ALPHANUMERIC.matcher(cased).replaceAll("") : cased;
    }

    /**
     * Upper-cases the first letter of every word and lower-cases the rest. Words written entirely
     * in upper case are kept as acronyms.
     */
    static String toTitleCase(String input) {
        StringBuilder result = new StringBuilder(input.length());
        int i = 0;
        while (i < input.length()) {
            if (!Character.isLetterOrDigit(input.charAt(i))) {
                result.append(input.charAt(i++));
                continue;
            }
            int end = i;
            while (end < input.length() && Character.isLetterOrDigit(input.charAt(end))) {
                end++;
            }
            String word = input.substring(i, end);
            if (word.equals(word.toUpperCase(Locale.ROOT))) {
                result.append(word);
            } else {
                result.append(Character.toUpperCase(word.charAt(0)))
                    .append(word.substring(1).toLowerCase(Locale.ROOT));
            }
            i = end;
        }
        return result.toString();
    }

    /**
     * Returns the names of the {@code {name}} tokens of a path, in order.
     *
     * @param path canonical path
     * @return token names
     */
    public static List<String> routeParameterNames(String path) {
        List<String> names = new ArrayList<>();
        Matcher matcher = ROUTE_PARAM.matcher(path);
        while (matcher.find()) {
            names.add(matcher.group());
        }
        return names;
    }

    /**
     * Maps constrained route parameters of a raw template to the type hinted by their first
     * constraint. Unknown constraints hint at a string.
     *
     * @param routeTemplate raw route template
     * @param options documentation policy holding the constraint map
     * @return parameter name to hinted type
     */
    public static Map<String, WireType> constraintTypes(String routeTemplate, DocumentOptions options) {
        Map<String, WireType> types = new LinkedHashMap<>();
        for (String segment : routeTemplate.split("/")) {
            Matcher matcher = CONSTRAINED_SEGMENT.matcher(segment);
            while (matcher.find()) {
                String token = matcher.group();
                int end = token.indexOf('(') >= 0 ? token.indexOf('(') : token.length() - 1;
                String[] parts = token.substring(1, end).split(":");
                String name = parts[0].trim();
                String constraint = parts.length > 1 ? parts[1].replace("?", "").trim() : "";
                String hint = options.routeConstraints().get(constraint);
                types.put(name, hint != null ? WireType.parse(hint) : WireType.string());
            }
        }
        return types;
    }
}
