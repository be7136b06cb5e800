package feedwatch;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MessageTemplateTest {

    private final Source source = new Source(1, "natgeo", "National Geographic", null, null, true);
    private final Item item = Item.builder("abc").url("https://www.instagram.com/p/abc/").title("Sunrise").build();

    @Test
    void defaultTemplateMentionsHandle() {
        String text = MessageTemplate.render(Destination.of("chan"), source, item);

        assertEquals("Hey **@natgeo** just posted a new shot! Go check it out!", text);
    }

    @Test
    void customTemplateReplacesEveryPlaceholder() {
        Destination destination = new Destination("chan", "{display_name} ({username}): {title} {url} {unknown}", null);

        String text = MessageTemplate.render(destination, source, item);

        assertEquals("National Geographic (natgeo): Sunrise https://www.instagram.com/p/abc/ {unknown}", text);
    }

    @Test
    void displayNameFallsBackToHandle() {
        Map<String, String> values = MessageTemplate.placeholders(Source.of(2, "nasa"), item);

        assertEquals("nasa", values.get("display_name"));
    }

    @Test
    void blankTemplateUsesDefault() {
        Destination destination = new Destination("chan", "  ", null);

        assertEquals(MessageTemplate.render(MessageTemplate.DEFAULT_TEMPLATE,
                        MessageTemplate.placeholders(source, item)),
                MessageTemplate.render(destination, source, item));
    }
}
