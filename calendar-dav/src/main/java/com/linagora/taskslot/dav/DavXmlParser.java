/********************************************************************
 *  As a subpart of Twake Mail, this file is edited by Linagora.    *
 *                                                                  *
 *  https://twake-mail.com/                                         *
 *  https://linagora.com                                            *
 *                                                                  *
 *  This file is subject to The Affero Gnu Public License           *
 *  version 3.                                                      *
 *                                                                  *
 *  https://www.gnu.org/licenses/agpl-3.0.en.html                   *
 *                                                                  *
 *  This program is distributed in the hope that it will be         *
 *  useful, but WITHOUT ANY WARRANTY; without even the implied      *
 *  warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR         *
 *  PURPOSE. See the GNU Affero General Public License for          *
 *  more details.                                                   *
 ********************************************************************/

package com.linagora.taskslot.dav;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

import javax.xml.XMLConstants;
import javax.xml.namespace.NamespaceContext;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;

import org.apache.commons.lang3.StringUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Reads WebDAV multistatus responses.
 */
public class DavXmlParser {

    public record DavResource(String href, Optional<String> displayName, boolean calendar,
                              Optional<String> etag, Optional<String> calendarData) {
        public DavResource {
            Preconditions.checkNotNull(href, "'href' must not be null");
        }

        /**
         * Last non-empty path segment of the href, without its {@code .ics} suffix.
         */
        public String resourceName() {
            String path = StringUtils.stripEnd(href, "/");
            String name = path.substring(path.lastIndexOf('/') + 1);
            return StringUtils.removeEnd(name, ".ics");
        }
    }

    static class DavNamespaceContext implements NamespaceContext {
        @Override
        public String getNamespaceURI(String prefix) {
            if ("d".equals(prefix)) {
                return "DAV:";
            }
            if ("c".equals(prefix)) {
                return "urn:ietf:params:xml:ns:caldav";
            }
            return XMLConstants.NULL_NS_URI;
        }

        @Override
        public String getPrefix(String namespaceURI) {
            return null;
        }

        @Override
        public Iterator<String> getPrefixes(String namespaceURI) {
            return null;
        }
    }

    private static final DocumentBuilderFactory DOCUMENT_BUILDER_FACTORY;

    static {
        try {
            DOCUMENT_BUILDER_FACTORY = DocumentBuilderFactory.newInstance();
            DOCUMENT_BUILDER_FACTORY.setNamespaceAware(true);

            //https://www.blackhat.com/docs/us-15/materials/us-15-Wang-FileCry-The-New-Age-Of-XXE-java-wp.pdf
            DOCUMENT_BUILDER_FACTORY.setAttribute(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            DOCUMENT_BUILDER_FACTORY.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            DOCUMENT_BUILDER_FACTORY.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");

            //https://cheatsheetseries.owasp.org/cheatsheets/XML_External_Entity_Prevention_Cheat_Sheet.html
            DOCUMENT_BUILDER_FACTORY.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DOCUMENT_BUILDER_FACTORY.setFeature("http://xml.org/sax/features/external-general-entities", false);
            DOCUMENT_BUILDER_FACTORY.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            DOCUMENT_BUILDER_FACTORY.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            DOCUMENT_BUILDER_FACTORY.setXIncludeAware(false);
            DOCUMENT_BUILDER_FACTORY.setExpandEntityReferences(false);
        } catch (ParserConfigurationException e) {
            throw new RuntimeException(e);
        }
    }

    public static List<DavResource> parseMultistatus(byte[] xml) {
        try {
            Document doc = DOCUMENT_BUILDER_FACTORY.newDocumentBuilder()
                .parse(new ByteArrayInputStream(xml));
            XPath xpath = XPathFactory.newInstance().newXPath();
            xpath.setNamespaceContext(new DavNamespaceContext());

            NodeList responses = (NodeList) xpath.evaluate("/d:multistatus/d:response", doc, XPathConstants.NODESET);
            ImmutableList.Builder<DavResource> resources = ImmutableList.builder();
            for (int i = 0; i < responses.getLength(); i++) {
                resources.add(toResource(xpath, responses.item(i)));
            }
            return resources.build();
        } catch (ParserConfigurationException | IOException | SAXException | XPathExpressionException e) {
            throw new DavClientException("Unable to parse multistatus response", e);
        }
    }

    private static DavResource toResource(XPath xpath, Node response) throws XPathExpressionException {
        String href = text(xpath, "d:href", response).orElseThrow(() -> new DavClientException("Multistatus response without href"));
        boolean calendar = (Boolean) xpath.evaluate("d:propstat/d:prop/d:resourcetype/c:calendar", response, XPathConstants.BOOLEAN);
        return new DavResource(href,
            text(xpath, "d:propstat/d:prop/d:displayname", response),
            calendar,
            text(xpath, "d:propstat/d:prop/d:getetag", response),
            text(xpath, "d:propstat/d:prop/c:calendar-data", response));
    }

    private static Optional<String> text(XPath xpath, String expression, Node context) throws XPathExpressionException {
        Node node = (Node) xpath.evaluate(expression, context, XPathConstants.NODE);
        return Optional.ofNullable(node)
            .map(Node::getTextContent)
            .map(String::trim)
            .filter(StringUtils::isNotEmpty);
    }
}
