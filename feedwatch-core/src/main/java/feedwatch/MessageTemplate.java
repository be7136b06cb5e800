package feedwatch;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Renders notification text for {@link feedwatch.spi.Deliverer} implementations.
 *
 * <p>Supported placeholders are {@code {username}}, {@code {display_name}}, {@code {url}} and
 * {@code {title}}. Unknown placeholders are left untouched.
 */
public final class MessageTemplate {

    public static final String DEFAULT_TEMPLATE =
            "Hey **@{username}** just posted a new shot! Go check it out!";

    private MessageTemplate() {
    }

    /**
     * Renders the destination's template (or {@link #DEFAULT_TEMPLATE}) for an item.
     */
    public static String render(Destination destination, Source source, Item item) {
        Objects.requireNonNull(destination, "destination");
        String template = destination.messageTemplate();
        if (template == null || template.isBlank()) {
            template = DEFAULT_TEMPLATE;
        }
        return render(template, placeholders(source, item));
    }

    public static String render(String template, Map<String, String> placeholders) {
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(placeholders, "placeholders");
        String result = template;
        for (Map.Entry<String, String> e : placeholders.entrySet()) {
            String value = e.getValue() == null ? "" : e.getValue();
            result = result.replace("{" + e.getKey() + "}", value);
        }
        return result;
    }

    public static Map<String, String> placeholders(Source source, Item item) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(item, "item");
        Map<String, String> values = new LinkedHashMap<>();
        values.put("username", source.handle());
        values.put("display_name", source.displayNameOrHandle());
        values.put("url", item.url());
        values.put("title", item.title());
        return values;
    }
}
