package io.hearthwarrio.veilguard.webdriver;

import io.hearthwarrio.veilguard.core.host.HostAccessException;
import io.hearthwarrio.veilguard.core.host.HostDocument;
import io.hearthwarrio.veilguard.core.host.HostEvent;
import io.hearthwarrio.veilguard.core.host.HostEventListener;
import io.hearthwarrio.veilguard.core.host.HostNode;
import io.hearthwarrio.veilguard.core.host.Mutation;
import io.hearthwarrio.veilguard.core.host.MutationListener;
import io.hearthwarrio.veilguard.core.host.MutationSubscription;
import io.hearthwarrio.veilguard.core.host.Viewport;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link HostDocument} over the current page of a Selenium {@link WebDriver}.
 * <p>
 * Mutations and events are recorded in the page and reach Java only when {@link #drain()} is called. Events
 * therefore arrive after the page has handled them: {@link HostEvent#preventDefault()} and
 * {@link HostEvent#stopPropagation()} are recorded on the Java side only.
 * <p>
 * This class is not thread-safe and is expected to be used from a single test thread.
 */
public class WebDriverHostDocument implements HostDocument {

    private final WebDriver driver;
    private final JavascriptExecutor js;

    private final Map<WebElement, WebDriverHostNode> nodes = new HashMap<>();
    private final Map<Integer, MutationListener> observers = new HashMap<>();
    private final Map<Integer, HostEventListener> listeners = new HashMap<>();
    private int nextId = 1;
    private boolean bootstrapped;

    public WebDriverHostDocument(WebDriver driver) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        if (!(driver instanceof JavascriptExecutor)) {
            throw new IllegalArgumentException("driver must implement JavascriptExecutor: " + driver.getClass().getName());
        }
        this.js = (JavascriptExecutor) driver;
    }

    public WebDriver getDriver() {
        return driver;
    }

    // ----------- HostDocument -----------

    @Override
    public String getDomain() {
        Object v = script(BrowserScripts.DOMAIN);
        return v == null ? "" : String.valueOf(v);
    }

    @Override
    public HostNode getDocumentElement() {
        return wrap(script(BrowserScripts.DOCUMENT_ELEMENT));
    }

    @Override
    public HostNode getHead() {
        return wrap(script(BrowserScripts.HEAD));
    }

    @Override
    public HostNode getBody() {
        return wrap(script(BrowserScripts.BODY));
    }

    @Override
    public HostNode getElementById(String id) {
        List<WebElement> found = driver.findElements(By.id(id));
        return found.isEmpty() ? null : wrap(found.get(0));
    }

    @Override
    public HostNode createElement(String tagName) {
        return new WebDriverHostNode(this, tagName);
    }

    @Override
    public List<HostNode> querySelectorAll(String selector) {
        List<HostNode> out = new ArrayList<>();
        for (WebElement e : driver.findElements(By.cssSelector(selector))) {
            out.add(wrap(e));
        }
        return out;
    }

    @Override
    public Viewport getViewport() {
        Object raw = script(BrowserScripts.VIEWPORT);
        if (raw instanceof List && ((List<?>) raw).size() == 2) {
            List<?> v = (List<?>) raw;
            return new Viewport(num(v.get(0)), num(v.get(1)));
        }
        throw new HostAccessException("viewport is not available");
    }

    @Override
    public void addEventListener(String type, HostEventListener listener, boolean capture) {
        listen(null, type, listener, capture);
    }

    @Override
    public MutationSubscription observe(MutationListener listener, Set<String> attributeFilter) {
        Objects.requireNonNull(listener, "listener must not be null");
        bootstrap();
        int id = nextId++;
        List<String> filter = attributeFilter == null ? List.of() : new ArrayList<>(attributeFilter);
        script(BrowserScripts.OBSERVE, id, filter);
        observers.put(id, listener);
        return () -> {
            if (observers.remove(id) != null) {
                try {
                    script(BrowserScripts.DISCONNECT, id);
                } catch (RuntimeException e) {
                    // page is gone; its observer went with it
                    bootstrapped = false;
                }
            }
        };
    }

    // ----------- pumping -----------

    /**
     * Pulls the records queued in the page and delivers them: mutations in one batch per observer, events
     * one by one, all in recording order.
     *
     * @return number of delivered records, or -1 when the page no longer carries the recorder (navigation)
     */
    public int drain() {
        if (!bootstrapped) {
            return 0;
        }
        Object raw = js.executeScript(BrowserScripts.DRAIN);
        if (raw == null) {
            bootstrapped = false;
            return -1;
        }
        if (!(raw instanceof List)) {
            return 0;
        }
        return deliver((List<?>) raw);
    }

    int deliver(List<?> records) {
        Map<Integer, List<Mutation>> batches = new LinkedHashMap<>();
        List<Runnable> events = new ArrayList<>();
        int delivered = 0;

        for (Object o : records) {
            if (!(o instanceof Map)) {
                continue;
            }
            Map<?, ?> r = (Map<?, ?>) o;
            if ("mutation".equals(r.get("kind"))) {
                Mutation m = toMutation(r);
                if (m != null) {
                    batches.computeIfAbsent(intValue(r.get("observer")), k -> new ArrayList<>()).add(m);
                    delivered++;
                }
            } else if ("event".equals(r.get("kind"))) {
                HostEventListener l = listeners.get(intValue(r.get("listener")));
                HostNode target = wrap(r.get("target"));
                if (l != null && target != null) {
                    WebDriverHostEvent event = new WebDriverHostEvent(String.valueOf(r.get("type")), target);
                    events.add(() -> l.handleEvent(event));
                    delivered++;
                }
            }
        }

        for (Map.Entry<Integer, List<Mutation>> e : batches.entrySet()) {
            MutationListener l = observers.get(e.getKey());
            if (l != null) {
                l.onMutations(e.getValue());
            }
        }
        for (Runnable event : events) {
            event.run();
        }
        return delivered;
    }

    private Mutation toMutation(Map<?, ?> r) {
        HostNode target = wrap(r.get("target"));
        if (target == null) {
            return null;
        }
        if ("attributes".equals(r.get("type"))) {
            Object name = r.get("attribute");
            return name == null ? null : Mutation.attributes(target, String.valueOf(name));
        }
        return Mutation.childList(target, wrapAll(r.get("added")));
    }

    public boolean isRecorderInstalled() {
        return bootstrapped;
    }

    // ----------- node plumbing -----------

    /**
     * @return canonical node for {@code raw}, or null when it is not an element
     */
    public WebDriverHostNode wrap(Object raw) {
        if (!(raw instanceof WebElement)) {
            return null;
        }
        return nodes.computeIfAbsent((WebElement) raw, e -> new WebDriverHostNode(this, e));
    }

    List<HostNode> wrapAll(Object raw) {
        List<HostNode> out = new ArrayList<>();
        if (raw instanceof List) {
            for (Object o : (List<?>) raw) {
                HostNode n = wrap(o);
                if (n != null) {
                    out.add(n);
                }
            }
        }
        return out;
    }

    /**
     * Drops the canonical handle of an element that went stale.
     */
    void forget(WebElement element) {
        if (element != null) {
            nodes.remove(element);
        }
    }

    /**
     * @return number of elements with a canonical handle
     */
    public int getTrackedNodeCount() {
        return nodes.size();
    }

    void register(WebDriverHostNode materialized) {
        nodes.put(materialized.getElement(), materialized);
    }

    WebDriverHostNode adopt(HostNode node) {
        if (node instanceof WebDriverHostNode) {
            return (WebDriverHostNode) node;
        }
        throw new IllegalArgumentException("node does not belong to this document: " + node);
    }

    void listen(WebElement target, String type, HostEventListener listener, boolean capture) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        bootstrap();
        int id = nextId++;
        script(BrowserScripts.LISTEN, id, target, type, capture);
        listeners.put(id, listener);
    }

    private void bootstrap() {
        if (!bootstrapped) {
            script(BrowserScripts.BOOTSTRAP);
            bootstrapped = true;
        }
    }

    /**
     * Executes a script, reporting stale element references as {@link HostAccessException}.
     */
    Object script(String source, Object... args) {
        try {
            return js.executeScript(source, args);
        } catch (StaleElementReferenceException e) {
            throw new HostAccessException("element is stale", e);
        }
    }

    Object rawScript(String source, Object... args) {
        return js.executeScript(source, args);
    }

    private static int intValue(Object o) {
        return o instanceof Number ? ((Number) o).intValue() : -1;
    }

    private static double num(Object o) {
        return o instanceof Number ? ((Number) o).doubleValue() : 0.0;
    }
}
