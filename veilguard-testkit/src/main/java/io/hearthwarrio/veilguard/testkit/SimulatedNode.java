package io.hearthwarrio.veilguard.testkit;

import io.hearthwarrio.veilguard.core.host.ComputedStyle;
import io.hearthwarrio.veilguard.core.host.HostAccessException;
import io.hearthwarrio.veilguard.core.host.HostEventListener;
import io.hearthwarrio.veilguard.core.host.HostNode;
import io.hearthwarrio.veilguard.core.host.Rect;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link HostNode} backed by a jsoup {@link Element} of a {@link SimulatedPage}.
 * <p>
 * Instances are canonical: {@link SimulatedPage#wrap(Element)} returns the same object for the same element.
 */
public final class SimulatedNode implements HostNode {

    private final SimulatedPage page;
    private final Element element;

    SimulatedNode(SimulatedPage page, Element element) {
        this.page = Objects.requireNonNull(page, "page must not be null");
        this.element = Objects.requireNonNull(element, "element must not be null");
    }

    /**
     * @return backing jsoup element
     */
    public Element element() {
        return element;
    }

    public SimulatedPage page() {
        return page;
    }

    @Override
    public String getTagName() {
        return element.normalName();
    }

    @Override
    public String getAttribute(String name) {
        return element.hasAttr(name) ? element.attr(name) : null;
    }

    @Override
    public void setAttribute(String name, String value) {
        element.attr(name, value == null ? "" : value);
        page.recordAttribute(this, name);
    }

    @Override
    public HostNode getParent() {
        Element p = element.parent();
        if (p == null || p instanceof Document) {
            return null;
        }
        return page.wrap(p);
    }

    @Override
    public List<HostNode> getChildren() {
        List<HostNode> out = new ArrayList<>();
        for (Element c : element.children()) {
            out.add(page.wrap(c));
        }
        return out;
    }

    @Override
    public boolean isConnected() {
        return element.ownerDocument() == page.document();
    }

    @Override
    public boolean matches(String selector) {
        return element.is(selector);
    }

    @Override
    public HostNode querySelector(String selector) {
        for (Element e : element.select(selector)) {
            if (e != element) {
                return page.wrap(e);
            }
        }
        return null;
    }

    @Override
    public List<HostNode> querySelectorAll(String selector) {
        List<HostNode> out = new ArrayList<>();
        for (Element e : element.select(selector)) {
            if (e != element) {
                out.add(page.wrap(e));
            }
        }
        return out;
    }

    /**
     * Resolves style from the inline {@code style} attribute only.
     */
    @Override
    public ComputedStyle getComputedStyle() {
        requireConnected("style");
        Map<String, String> s = InlineStyle.parse(getAttribute("style"));
        return new ComputedStyle(s.get("position"), s.get("z-index"), s.get("display"), s.get("visibility"));
    }

    /**
     * Uses the box set with {@link SimulatedPage#layout(HostNode, Rect)}, otherwise the pixel values of
     * {@code left}, {@code top}, {@code width} and {@code height} in the inline style.
     */
    @Override
    public Rect getBoundingRect() {
        requireConnected("geometry");
        Rect explicit = page.layoutOf(this);
        if (explicit != null) {
            return explicit;
        }
        Map<String, String> s = InlineStyle.parse(getAttribute("style"));
        return new Rect(
                InlineStyle.pixels(s.get("left"), 0.0),
                InlineStyle.pixels(s.get("top"), 0.0),
                InlineStyle.pixels(s.get("width"), 0.0),
                InlineStyle.pixels(s.get("height"), 0.0)
        );
    }

    @Override
    public String getInnerText() {
        if (isDataElement()) {
            return element.data();
        }
        return element.text();
    }

    @Override
    public void setStyleProperty(String property, String value, boolean important) {
        Objects.requireNonNull(property, "property must not be null");
        element.attr("style", InlineStyle.write(getAttribute("style"), property, value == null ? "" : value, important));
        page.recordAttribute(this, "style");
    }

    /**
     * @param property CSS property name
     * @return inline value without priority, or null
     */
    public String inlineStyle(String property) {
        return InlineStyle.parse(getAttribute("style")).get(property);
    }

    @Override
    public void setTextContent(String text) {
        String t = text == null ? "" : text;
        if (isDataElement()) {
            element.empty().appendChild(new DataNode(t));
        } else {
            element.text(t);
        }
        page.recordChildList(this, List.of());
    }

    @Override
    public void appendChild(HostNode child) {
        SimulatedNode c = page.adopt(child);
        element.appendChild(c.element);
        page.recordChildList(this, List.of(c));
    }

    @Override
    public void remove() {
        Element p = element.parent();
        if (p == null) {
            throw new HostAccessException("element is already detached: <" + getTagName() + ">");
        }
        boolean wasConnected = isConnected();
        element.remove();
        if (wasConnected && !(p instanceof Document)) {
            page.recordChildList(page.wrap(p), List.of());
        }
    }

    @Override
    public void addEventListener(String type, HostEventListener listener, boolean capture) {
        page.addListener(this, type, listener, capture);
    }

    private boolean isDataElement() {
        String tag = element.normalName();
        return "style".equals(tag) || "script".equals(tag);
    }

    private void requireConnected(String what) {
        if (!isConnected()) {
            throw new HostAccessException("cannot read " + what + " of detached element <" + getTagName() + ">");
        }
    }

    @Override
    public String toString() {
        String id = element.id();
        return "SimulatedNode{<" + getTagName() + (id.isEmpty() ? "" : " id=" + id) + ">}";
    }
}
