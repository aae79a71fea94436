package com.flagship.member_payments.notification;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.util.HtmlUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders classpath email templates.
 *
 * Syntax:
 * - {@code {{key}}}: value, HTML-escaped
 * - {@code {{{key}}}}: value inserted as is (callers escape it themselves)
 * - {@code {{#key}}...{{/key}}}: kept only when key is present and not blank or false
 *
 * The body is wrapped in {@code layout.html}, which adds the unsubscribe link
 * and the support address. Templates are cached after first load.
 */
@Component
public class TemplateRenderer {

    static final String TEMPLATE_LOCATION = "templates/email/";
    private static final String LAYOUT = "layout";

    private static final Pattern SECTION = Pattern.compile("\\{\\{#(\\w+)}}(.*?)\\{\\{/\\1}}", Pattern.DOTALL);
    private static final Pattern RAW = Pattern.compile("\\{\\{\\{(\\w+)}}}");
    private static final Pattern ESCAPED = Pattern.compile("\\{\\{(\\w+)}}");
    private static final Pattern TAG = Pattern.compile("<[^>]+>");

    private final Map<String, String> cache = new ConcurrentHashMap<>();
    private final String unsubscribeUrl;
    private final String supportEmail;

    public TemplateRenderer(@Value("${notifications.unsubscribe-url:}") String unsubscribeUrl,
                            @Value("${notifications.support-email:}") String supportEmail) {
        this.unsubscribeUrl = unsubscribeUrl;
        this.supportEmail = supportEmail;
    }

    /**
     * @throws IllegalStateException if the template is missing from the classpath
     */
    public RenderedEmail render(EmailTemplate template, Map<String, ?> model) {
        String body = apply(load(template.getTemplateName()), model);

        Map<String, Object> layoutModel = new HashMap<>(model);
        layoutModel.put("content", body);
        layoutModel.put("unsubscribeUrl", unsubscribeUrl);
        layoutModel.put("supportEmail", supportEmail);
        layoutModel.put("showUnsubscribe", template.getCategory() != NotificationCategory.SYSTEM);
        String html = apply(load(LAYOUT), layoutModel);

        return new RenderedEmail(subject(template, model), html, toText(html));
    }

    /**
     * Subject line only. Subjects live on the enum, so this works even when the body template is missing.
     */
    public String subject(EmailTemplate template, Map<String, ?> model) {
        return replace(ESCAPED, template.getSubject(), model, false);
    }

    static String apply(String template, Map<String, ?> model) {
        String withSections = expandSections(template, model);
        String withRaw = replace(RAW, withSections, model, false);
        return replace(ESCAPED, withRaw, model, true);
    }

    private static String expandSections(String template, Map<String, ?> model) {
        Matcher matcher = SECTION.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String inner = isPresent(model.get(matcher.group(1))) ? expandSections(matcher.group(2), model) : "";
            matcher.appendReplacement(out, Matcher.quoteReplacement(inner));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static String replace(Pattern pattern, String template, Map<String, ?> model, boolean escape) {
        Matcher matcher = pattern.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            Object value = model.get(matcher.group(1));
            String text = value == null ? "" : value.toString();
            matcher.appendReplacement(out, Matcher.quoteReplacement(escape ? HtmlUtils.htmlEscape(text) : text));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static boolean isPresent(Object value) {
        if (value == null || Boolean.FALSE.equals(value)) {
            return false;
        }
        return !(value instanceof CharSequence) || !value.toString().isBlank();
    }

    private static String toText(String html) {
        String text = TAG.matcher(html.replaceAll("(?i)<br\\s*/?>|</p>|</tr>|</h\\d>", "\n")).replaceAll("");
        return HtmlUtils.htmlUnescape(text).replaceAll("[ \\t]+", " ").replaceAll("\\s*\\n\\s*", "\n").trim();
    }

    private String load(String name) {
        return cache.computeIfAbsent(name, key -> {
            ClassPathResource resource = new ClassPathResource(TEMPLATE_LOCATION + key + ".html");
            if (!resource.exists()) {
                throw new IllegalStateException("Email template '" + key + "' not found");
            }
            try (InputStream in = resource.getInputStream()) {
                return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read email template " + key, e);
            }
        });
    }
}
