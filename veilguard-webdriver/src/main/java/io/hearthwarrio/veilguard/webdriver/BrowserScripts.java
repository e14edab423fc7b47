package io.hearthwarrio.veilguard.webdriver;

/**
 * JavaScript snippets executed through {@link org.openqa.selenium.JavascriptExecutor}.
 * <p>
 * Observers and listeners installed in the page push records into {@code window.__veilguard.queue};
 * {@link #DRAIN} hands the queue back to Java and empties it.
 */
final class BrowserScripts {

    private BrowserScripts() {
        // utility class
    }

    static final String BOOTSTRAP =
            "var w=window;" +
                    "if(!w.__veilguard){w.__veilguard={queue:[],observers:{},listeners:{}};}" +
                    "return true;";

    static final String DRAIN =
            "var v=window.__veilguard;" +
                    "if(!v){return null;}" +
                    "var q=v.queue;v.queue=[];return q;";

    /**
     * arguments: observer id, attribute filter (array).
     */
    static final String OBSERVE =
            "var v=window.__veilguard,id=arguments[0],filter=arguments[1];" +
                    "var o=new MutationObserver(function(recs){" +
                    "for(var i=0;i<recs.length;i++){var r=recs[i],added=[];" +
                    "for(var j=0;j<r.addedNodes.length;j++){if(r.addedNodes[j].nodeType===1){added.push(r.addedNodes[j]);}}" +
                    "if(r.target.nodeType!==1){continue;}" +
                    "v.queue.push({kind:'mutation',observer:id,type:r.type,target:r.target,added:added,attribute:r.attributeName});}});" +
                    "var opts={childList:true,subtree:true};" +
                    "if(filter.length>0){opts.attributes=true;opts.attributeFilter=filter;}" +
                    "o.observe(document.documentElement,opts);v.observers[id]=o;return true;";

    /**
     * arguments: observer id.
     */
    static final String DISCONNECT =
            "var v=window.__veilguard;" +
                    "if(v&&v.observers[arguments[0]]){v.observers[arguments[0]].disconnect();delete v.observers[arguments[0]];}" +
                    "return true;";

    /**
     * arguments: listener id, target element (null for the document), event type, capture flag.
     */
    static final String LISTEN =
            "var v=window.__veilguard,id=arguments[0],t=arguments[1]||document;" +
                    "var fn=function(e){v.queue.push({kind:'event',listener:id,type:e.type," +
                    "target:(e.target&&e.target.nodeType===1)?e.target:null});};" +
                    "t.addEventListener(arguments[2],fn,arguments[3]);v.listeners[id]=fn;return true;";

    static final String DOMAIN = "return location.hostname || '';";

    static final String VIEWPORT = "return [window.innerWidth, window.innerHeight];";

    static final String DOCUMENT_ELEMENT = "return document.documentElement;";

    static final String HEAD = "return document.head;";

    static final String BODY = "return document.body;";

    static final String PARENT = "return arguments[0].parentElement;";

    static final String CHILDREN = "return Array.prototype.slice.call(arguments[0].children);";

    static final String IS_CONNECTED = "return arguments[0].isConnected === true;";

    static final String MATCHES = "return arguments[0].matches(arguments[1]);";

    static final String QUERY_ALL = "return Array.prototype.slice.call(arguments[0].querySelectorAll(arguments[1]));";

    static final String COMPUTED_STYLE =
            "var s=window.getComputedStyle(arguments[0]);" +
                    "return {position:s.position,zIndex:s.zIndex,display:s.display,visibility:s.visibility};";

    static final String BOUNDING_RECT =
            "var r=arguments[0].getBoundingClientRect();return [r.left,r.top,r.width,r.height];";

    static final String INNER_TEXT = "return arguments[0].innerText || '';";

    static final String SET_ATTRIBUTE = "arguments[0].setAttribute(arguments[1], arguments[2]);";

    static final String SET_STYLE = "arguments[0].style.setProperty(arguments[1], arguments[2], arguments[3] ? 'important' : '');";

    static final String SET_TEXT = "arguments[0].textContent = arguments[1];";

    static final String APPEND_CHILD = "arguments[0].appendChild(arguments[1]);";

    static final String REMOVE = "arguments[0].remove();";

    /**
     * arguments: parent element, tag name, attributes (object), style declarations (array of [name, value, important]),
     * text (may be null). Builds the element inside the live document and returns it.
     */
    static final String MATERIALIZE =
            "var el=document.createElement(arguments[1]),a=arguments[2],s=arguments[3];" +
                    "for(var k in a){if(Object.prototype.hasOwnProperty.call(a,k)){el.setAttribute(k,a[k]);}}" +
                    "for(var i=0;i<s.length;i++){el.style.setProperty(s[i][0],s[i][1],s[i][2]?'important':'');}" +
                    "if(arguments[4]!==null){el.textContent=arguments[4];}" +
                    "arguments[0].appendChild(el);return el;";
}
