package io.mersel.services.testcase.infrastructure;

import io.mersel.services.testcase.application.interfaces.DocumentParseException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
 * DOM giriş/çıkış yardımcıları.
 * <p>
 * Codec'ler ham DOM'u doğrudan incelemez; tekrarlanabilir alanlar her zaman liste,
 * metin yaprakları her zaman String olarak buradan okunur. Metin içeriği olduğu gibi
 * korunur, kırpma yalnızca {@link #values} ile yapılır. Eleman eşleşmesi
 * namespace'ten bağımsızdır (local name).
 */
final class XmlNodes {

    static final String XSI_NS = "http://www.w3.org/2001/XMLSchema-instance";
    private static final String XMLNS_NS = "http://www.w3.org/2000/xmlns/";

    private XmlNodes() {
    }

    // ── Okuma ──

    /**
     * XML metnini XXE korumalı bir DOM'a çevirir ve kök elemanı doğrular.
     *
     * @throws DocumentParseException XML bozuksa veya kök eleman beklenen değilse
     */
    static Element parseRoot(String xml, String source, String expectedRoot) throws DocumentParseException {
        if (xml == null || xml.isBlank()) {
            throw new DocumentParseException(source, "XML içeriği boş: " + source);
        }

        Document doc;
        try {
            var builder = secureFactory().newDocumentBuilder();
            // fatal hatalar exception olarak gelir, stderr'e yazılmaz
            builder.setErrorHandler(new DefaultHandler());
            doc = builder.parse(new InputSource(new StringReader(xml)));
        } catch (Exception e) {
            throw new DocumentParseException(source,
                    "XML parse hatası (" + source + "): " + e.getMessage(), e);
        }

        Element root = doc.getDocumentElement();
        if (root == null || !expectedRoot.equals(localName(root))) {
            throw new DocumentParseException(source,
                    "Beklenen kök eleman '" + expectedRoot + "' bulunamadı (" + source + ")");
        }
        return root;
    }

    /**
     * Verilen adlardan birini taşıyan doğrudan alt elemanlar, belge sırasıyla.
     */
    static List<Element> children(Element parent, String... names) {
        var result = new ArrayList<Element>();
        if (parent == null) {
            return result;
        }
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && matches(node, names)) {
                result.add((Element) node);
            }
        }
        return result;
    }

    /**
     * Verilen adlardan birini taşıyan ilk doğrudan alt eleman. Adlar öncelik sırasıyla denenir.
     */
    static Element child(Element parent, String... names) {
        for (String name : names) {
            List<Element> found = children(parent, name);
            if (!found.isEmpty()) {
                return found.get(0);
            }
        }
        return null;
    }

    /**
     * Elemanın metin içeriği, baştaki ve sondaki boşluklar dahil; eleman yoksa boş String.
     */
    static String text(Element element) {
        if (element == null) {
            return "";
        }
        String content = element.getTextContent();
        return content != null ? content : "";
    }

    static String childText(Element parent, String... names) {
        return text(child(parent, names));
    }

    /**
     * {@code container/item*} yapısındaki metinler, boş elemanlar {@code ""} olarak.
     * Container yoksa boş liste.
     */
    static List<String> texts(Element container, String itemName) {
        var result = new ArrayList<String>();
        for (Element item : children(container, itemName)) {
            result.add(text(item));
        }
        return result;
    }

    /**
     * Anahtar niteliğindeki değerler (profil adları, cevap değerleri): kırpılmış, boşlar atlanır.
     */
    static List<String> values(Element container, String itemName) {
        var result = new ArrayList<String>();
        for (Element item : children(container, itemName)) {
            String value = text(item).strip();
            if (!value.isEmpty()) {
                result.add(value);
            }
        }
        return result;
    }

    /**
     * Attribute değeri; yoksa veya boşsa {@code null}.
     */
    static String attr(Element element, String name) {
        if (element == null || !element.hasAttribute(name)) {
            return null;
        }
        String value = element.getAttribute(name);
        return value.isEmpty() ? null : value;
    }

    static String attr(Element element, String name, String defaultValue) {
        String value = attr(element, name);
        return value != null ? value : defaultValue;
    }

    static boolean hasElementChildren(Element element) {
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i).getNodeType() == Node.ELEMENT_NODE) {
                return true;
            }
        }
        return false;
    }

    // ── Yazma ──

    static Document newDocument() {
        try {
            Document doc = secureFactory().newDocumentBuilder().newDocument();
            doc.setXmlStandalone(true);
            return doc;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("DOM oluşturulamadı: " + e.getMessage(), e);
        }
    }

    /**
     * {@code parent} altına metin içerikli bir eleman ekler ve onu döndürür.
     * {@code namespace} {@code null} ise eleman namespace'siz oluşturulur.
     */
    static Element appendText(Element parent, String namespace, String name, String value) {
        Element element = appendElement(parent, namespace, name);
        element.setTextContent(value != null ? value : "");
        return element;
    }

    static Element appendElement(Element parent, String namespace, String name) {
        Document doc = parent.getOwnerDocument();
        Element element = doc.createElementNS(namespace, name);
        parent.appendChild(element);
        return element;
    }

    static void declareDefaultNamespace(Element root, String namespace) {
        root.setAttributeNS(XMLNS_NS, "xmlns", namespace);
    }

    static void declareXsi(Element root) {
        root.setAttributeNS(XMLNS_NS, "xmlns:xsi", XSI_NS);
    }

    /**
     * DOM'u UTF-8 bildirimli, girintili XML metnine çevirir.
     */
    static String serialize(Document doc) {
        try {
            var tf = TransformerFactory.newInstance();
            var transformer = tf.newTransformer();
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "no");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");

            var writer = new StringWriter();
            transformer.transform(new DOMSource(doc), new StreamResult(writer));
            return writer.toString();
        } catch (TransformerException e) {
            throw new IllegalStateException("XML serileştirme hatası: " + e.getMessage(), e);
        }
    }

    // ── Yardımcılar ──

    private static DocumentBuilderFactory secureFactory() throws ParserConfigurationException {
        var factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        // XXE koruma
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setExpandEntityReferences(false);
        return factory;
    }

    private static boolean matches(Node node, String... names) {
        String local = localName(node);
        for (String name : names) {
            if (name.equals(local)) {
                return true;
            }
        }
        return false;
    }

    private static String localName(Node node) {
        return node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
    }
}
