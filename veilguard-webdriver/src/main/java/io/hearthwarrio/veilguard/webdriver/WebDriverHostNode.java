package io.hearthwarrio.veilguard.webdriver;

import io.hearthwarrio.veilguard.core.host.ComputedStyle;
import io.hearthwarrio.veilguard.core.host.HostAccessException;
import io.hearthwarrio.veilguard.core.host.HostEventListener;
import io.hearthwarrio.veilguard.core.host.HostNode;
import io.hearthwarrio.veilguard.core.host.Rect;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.WebElement;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * {@link HostNode} backed by a Selenium {@link WebElement}.
 * <p>
 * Elements created with {@link WebDriverHostDocument#createElement(String)} start as local drafts: attribute,
 * style and text writes are buffered until the draft is appended to a live element, which builds it inside
 * the page in one script call.
 * <p>
 * Stale references read as disconnected; other reads of stale elements throw {@link HostAccessException}.
 * Either way the document drops its handle for the element.
 */
public final class WebDriverHostNode implements HostNode {

    private final WebDriverHostDocument document;
    private WebElement element;

    private final String draftTag;
    private final Map<String, String> draftAttributes = new LinkedHashMap<>();
    private final List<List<Object>> draftStyles = new ArrayList<>();
    private String draftText;

    WebDriverHostNode(WebDriverHostDocument document, WebElement element) {
        this.document = Objects.requireNonNull(document, "document must not be null");
        this.element = Objects.requireNonNull(element, "element must not be null");
        this.draftTag = null;
    }

    WebDriverHostNode(WebDriverHostDocument document, String draftTag) {
        this.document = Objects.requireNonNull(document, "document must not be null");
        this.draftTag = Objects.requireNonNull(draftTag, "draftTag must not be null").toLowerCase(Locale.ROOT);
    }

    /**
     * @return backing element, or null while this node is a draft
     */
    public WebElement getElement() {
        return element;
    }

    public boolean isDraft() {
        return element == null;
    }

    @Override
    public String getTagName() {
        if (isDraft()) {
            return draftTag;
        }
        return live(() -> element.getTagName().toLowerCase(Locale.ROOT));
    }

    @Override
    public String getAttribute(String name) {
        if (isDraft()) {
            return draftAttributes.get(name);
        }
        return live(() -> element.getDomAttribute(name));
    }

    @Override
    public void setAttribute(String name, String value) {
        if (isDraft()) {
            draftAttributes.put(name, value == null ? "" : value);
            return;
        }
        document.script(BrowserScripts.SET_ATTRIBUTE, element, name, value == null ? "" : value);
    }

    @Override
    public HostNode getParent() {
        if (isDraft()) {
            return null;
        }
        try {
            return document.wrap(document.script(BrowserScripts.PARENT, element));
        } catch (HostAccessException e) {
            return null;
        }
    }

    @Override
    public List<HostNode> getChildren() {
        if (isDraft()) {
            return List.of();
        }
        return document.wrapAll(document.script(BrowserScripts.CHILDREN, element));
    }

    @Override
    public boolean isConnected() {
        if (isDraft()) {
            return false;
        }
        try {
            return Boolean.TRUE.equals(document.rawScript(BrowserScripts.IS_CONNECTED, element));
        } catch (StaleElementReferenceException e) {
            document.forget(element);
            return false;
        }
    }

    @Override
    public boolean matches(String selector) {
        requireLive("match");
        return Boolean.TRUE.equals(document.script(BrowserScripts.MATCHES, element, selector));
    }

    @Override
    public HostNode querySelector(String selector) {
        List<HostNode> all = querySelectorAll(selector);
        return all.isEmpty() ? null : all.get(0);
    }

    @Override
    public List<HostNode> querySelectorAll(String selector) {
        if (isDraft()) {
            return List.of();
        }
        return document.wrapAll(document.script(BrowserScripts.QUERY_ALL, element, selector));
    }

    @Override
    public ComputedStyle getComputedStyle() {
        requireLive("style");
        Object raw = document.script(BrowserScripts.COMPUTED_STYLE, element);
        if (!(raw instanceof Map)) {
            throw new HostAccessException("computed style is not available");
        }
        Map<?, ?> m = (Map<?, ?>) raw;
        return new ComputedStyle(str(m.get("position")), str(m.get("zIndex")), str(m.get("display")), str(m.get("visibility")));
    }

    @Override
    public Rect getBoundingRect() {
        requireLive("geometry");
        Object raw = document.script(BrowserScripts.BOUNDING_RECT, element);
        if (!(raw instanceof List) || ((List<?>) raw).size() != 4) {
            throw new HostAccessException("geometry is not available");
        }
        List<?> r = (List<?>) raw;
        return new Rect(num(r.get(0)), num(r.get(1)), num(r.get(2)), num(r.get(3)));
    }

    @Override
    public String getInnerText() {
        if (isDraft()) {
            return draftText == null ? "" : draftText;
        }
        return str(document.script(BrowserScripts.INNER_TEXT, element));
    }

    @Override
    public void setStyleProperty(String property, String value, boolean important) {
        if (isDraft()) {
            draftStyles.add(List.of(property, value == null ? "" : value, important));
            return;
        }
        document.script(BrowserScripts.SET_STYLE, element, property, value == null ? "" : value, important);
    }

    @Override
    public void setTextContent(String text) {
        if (isDraft()) {
            draftText = text == null ? "" : text;
            return;
        }
        document.script(BrowserScripts.SET_TEXT, element, text == null ? "" : text);
    }

    @Override
    public void appendChild(HostNode child) {
        requireLive("append into");
        WebDriverHostNode c = document.adopt(child);
        if (c.isDraft()) {
            Object created = document.script(
                    BrowserScripts.MATERIALIZE,
                    element,
                    c.draftTag,
                    new LinkedHashMap<>(c.draftAttributes),
                    new ArrayList<>(c.draftStyles),
                    c.draftText
            );
            if (!(created instanceof WebElement)) {
                throw new HostAccessException("element could not be created: <" + c.draftTag + ">");
            }
            c.element = (WebElement) created;
            document.register(c);
            return;
        }
        document.script(BrowserScripts.APPEND_CHILD, element, c.element);
    }

    @Override
    public void remove() {
        if (isDraft()) {
            throw new HostAccessException("element is not attached: <" + draftTag + ">");
        }
        document.script(BrowserScripts.REMOVE, element);
    }

    @Override
    public void addEventListener(String type, HostEventListener listener, boolean capture) {
        requireLive("listen on");
        document.listen(element, type, listener, capture);
    }

    private void requireLive(String what) {
        if (isDraft()) {
            throw new HostAccessException("cannot " + what + " element that is not attached: <" + draftTag + ">");
        }
    }

    private <T> T live(Supplier<T> read) {
        try {
            return read.get();
        } catch (StaleElementReferenceException e) {
            document.forget(element);
            throw new HostAccessException("element is stale", e);
        }
    }

    private static String str(Object o) {
        return o == null ? "" : String.valueOf(o);
    }

    private static double num(Object o) {
        return o instanceof Number ? ((Number) o).doubleValue() : 0.0;
    }

    @Override
    public String toString() {
        return isDraft() ? "WebDriverHostNode{draft <" + draftTag + ">}" : "WebDriverHostNode{" + element + "}";
    }
}
