package net.wsrooms.ws;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps request paths to room names.
 * Routes are tried in the order they were added; the first whose pattern
 * matches the whole path wins. A route added with a template may refer to
 * the groups of its pattern as \1 or \{1}; \\ stands for a backslash.
 */
public class RoomRoutes {

    private static final Pattern REFERENCE =
        Pattern.compile("\\\\([0-9]+|\\{[0-9]+\\}|.)");

    private static class Route {

        final Pattern pattern;
        final String target;
        final boolean template;

        Route(Pattern pattern, String target, boolean template) {
            this.pattern = pattern;
            this.target = target;
            this.template = template;
        }

        String apply(String path) {
            Matcher m = pattern.matcher(path);
            if (! m.matches()) return null;
            return (template) ? expand(m, target) : target;
        }

        public String toString() {
            return pattern.pattern() + " -> " + target;
        }

    }

    private final List<Route> routes;

    public RoomRoutes() {
        routes = new CopyOnWriteArrayList<Route>();
    }

    /**
     * Route exactly path to the room called name.
     */
    public void mount(String path, String name) {
        routes.add(new Route(Pattern.compile(Pattern.quote(path)), name,
                             false));
    }

    /**
     * Route paths matching pattern to the room named by template.
     * The template is checked eagerly so that bad references fail here
     * rather than on the first request.
     */
    public void add(Pattern pattern, String template) {
        Matcher rm = REFERENCE.matcher(template);
        while (rm.find()) {
            String ref = rm.group(1);
            if (ref.equals("\\")) continue;
            if (groupIndex(ref) > pattern.matcher("").groupCount())
                throw new IllegalArgumentException("Template " + template +
                    " refers to a group " + pattern + " lacks");
        }
        routes.add(new Route(pattern, template, true));
    }

    public int size() {
        return routes.size();
    }

    /**
     * Return the room name for path, or null if no route matches.
     */
    public String resolve(String path) {
        for (Route r : routes) {
            String name = r.apply(path);
            if (name != null) return name;
        }
        return null;
    }

    private static int groupIndex(String ref) {
        if (ref.startsWith("{")) ref = ref.substring(1, ref.length() - 1);
        try {
            return Integer.parseInt(ref);
        } catch (NumberFormatException exc) {
            throw new IllegalArgumentException("Invalid reference \\" + ref,
                                               exc);
        }
    }

    private static String expand(Matcher m, String template) {
        Matcher rm = REFERENCE.matcher(template);
        StringBuilder sb = new StringBuilder();
        int last = 0;
        while (rm.find()) {
            sb.append(template, last, rm.start());
            String ref = rm.group(1);
            if (ref.equals("\\")) {
                sb.append('\\');
            } else {
                String g = m.group(groupIndex(ref));
                if (g != null) sb.append(g);
            }
            last = rm.end();
        }
        sb.append(template, last, template.length());
        return sb.toString();
    }

}
