package com.easybuild.core.version;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of an MSBuild project file.
 *
 * <p>Project files are inconsistent about namespaces: legacy Xamarin projects declare
 * the MSBuild default namespace, SDK-style projects declare none. Every lookup tries the
 * root's namespace-qualified name first and then the unqualified name.
 *
 * <p>This class never writes. Edits go through {@link XmlTagEditor} so the file's own
 * formatting survives.
 */
final class CsprojDocument {

    private final Document document;
    private final String rootNamespace;

    private CsprojDocument(Document document) {
        this.document = document;
        this.rootNamespace = document.getDocumentElement().getNamespaceURI();
    }

    /**
     * Parses a project file with DTDs and external entities disabled.
     *
     * @throws IOException if the file cannot be read or is not well-formed XML
     */
    static CsprojDocument parse(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            var factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setExpandEntityReferences(false);
            return new CsprojDocument(factory.newDocumentBuilder().parse(in));
        } catch (SAXException | ParserConfigurationException e) {
            throw new IOException("Invalid XML in %s: %s".formatted(file.getFileName(), e.getMessage()), e);
        }
    }

    /**
     * Returns the first non-blank value of {@code tag} directly inside any {@code PropertyGroup}.
     */
    Optional<String> propertyValue(String tag) {
        for (Element group : elements(document.getDocumentElement(), "PropertyGroup")) {
            for (Element child : children(group, tag)) {
                String text = child.getTextContent();
                if (text != null && !text.isBlank()) {
                    return Optional.of(text.strip());
                }
            }
        }
        return Optional.empty();
    }

    boolean hasProperty(String tag) {
        for (Element group : elements(document.getDocumentElement(), "PropertyGroup")) {
            if (!children(group, tag).isEmpty()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Descendants of {@code parent} named {@code localName}: qualified lookup first,
     * unqualified as fallback.
     */
    private List<Element> elements(Element parent, String localName) {
        if (rootNamespace != null) {
            var qualified = toElements(parent.getElementsByTagNameNS(rootNamespace, localName));
            if (!qualified.isEmpty()) {
                return qualified;
            }
        }
        return toElements(parent.getElementsByTagName(localName));
    }

    private List<Element> children(Element parent, String localName) {
        var qualified = new ArrayList<Element>();
        var unqualified = new ArrayList<Element>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() != Node.ELEMENT_NODE) {
                continue;
            }
            Element element = (Element) node;
            if (rootNamespace != null
                    && rootNamespace.equals(element.getNamespaceURI())
                    && localName.equals(element.getLocalName())) {
                qualified.add(element);
            } else if (localName.equals(element.getTagName())) {
                unqualified.add(element);
            }
        }
        return qualified.isEmpty() ? unqualified : qualified;
    }

    private static List<Element> toElements(NodeList nodes) {
        var result = new ArrayList<Element>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        return result;
    }
}
