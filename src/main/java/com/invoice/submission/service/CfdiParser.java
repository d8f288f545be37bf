package com.invoice.submission.service;

import com.invoice.submission.config.SubmissionProperties;
import com.invoice.submission.model.CanonicalInvoiceRecord;
import com.invoice.submission.model.UploadedFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reduces a CFDI 3.3 / 4.0 payload to a {@link CanonicalInvoiceRecord}.
 *
 * Never throws: malformed markup or a foreign root element produce a record with
 * {@code parseError} set so the file still shows up in the batch. A missing stamp,
 * issuer or tax block only leaves the matching fields empty.
 */
@Service
@Slf4j
public class CfdiParser {

    private static final String ROOT_ELEMENT = "Comprobante";
    private static final List<String> ISSUER_TAX_ID_ATTRIBUTES = List.of("Rfc", "RfcEmisor");
    private static final Set<String> VAT_TAX_CODES = Set.of("002", "2");

    private final SubmissionProperties properties;

    public CfdiParser(SubmissionProperties properties) {
        this.properties = properties;
    }

    public CanonicalInvoiceRecord parse(UploadedFile file) {
        String sourceFileName = file.getFileName();
        try {
            Element root = readRoot(file.getContent());
            CfdiSchema schema = detectSchema(root);
            log.debug("{}: CFDI {} ({})", sourceFileName, schema.getVersion(), root.getNamespaceURI());

            return CanonicalInvoiceRecord.builder()
                    .sourceFileName(sourceFileName)
                    .identifier(extractIdentifier(root))
                    .issuerTaxId(extractIssuerTaxId(root, schema))
                    .currencyCode(nonBlankOr(root.getAttribute("Moneda"), properties.getDefaultCurrency()))
                    .totalAmount(nonBlankOr(root.getAttribute("Total"), "0"))
                    .taxAmount(sumValueAddedTax(root, schema, sourceFileName))
                    .issueDate(parseIssueDate(root.getAttribute("Fecha")))
                    .expenseCategory(properties.getDefaultCategory())
                    .build();

        } catch (InvalidCfdiException | SAXException | IOException e) {
            log.warn("Could not read CFDI {}: {}", sourceFileName, e.getMessage());
            return CanonicalInvoiceRecord.failed(sourceFileName, describe(e),
                    properties.getDefaultCurrency(), properties.getDefaultCategory());
        }
    }

    // ─── DOCUMENT ──────────────────────────────────────────────────────────

    private Element readRoot(byte[] content) throws InvalidCfdiException, SAXException, IOException {
        if (content == null || content.length == 0) {
            throw new InvalidCfdiException("Empty payload");
        }

        Document document = newDocumentBuilder().parse(new ByteArrayInputStream(content));
        Element root = document.getDocumentElement();
        if (root == null || !ROOT_ELEMENT.equals(root.getLocalName())) {
            throw new InvalidCfdiException("Root element is not a CFDI Comprobante: "
                    + (root == null ? "none" : root.getTagName()));
        }
        return root;
    }

    private DocumentBuilder newDocumentBuilder() throws InvalidCfdiException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            // fatal errors are rethrown as SAXException instead of printed to stderr
            builder.setErrorHandler(new DefaultHandler());
            return builder;
        } catch (ParserConfigurationException e) {
            throw new InvalidCfdiException("XML parser unavailable: " + e.getMessage());
        }
    }

    /**
     * First schema whose namespace is declared by the root element, either as its own
     * namespace or in any attribute (xmlns declarations, schemaLocation). Otherwise the oldest.
     */
    CfdiSchema detectSchema(Element root) {
        for (CfdiSchema schema : CfdiSchema.values()) {
            if (schema.declares(root.getNamespaceURI())) {
                return schema;
            }
            NamedNodeMap attributes = root.getAttributes();
            for (int i = 0; i < attributes.getLength(); i++) {
                if (schema.declares(attributes.item(i).getNodeValue())) {
                    return schema;
                }
            }
        }
        return CfdiSchema.fallback();
    }

    // ─── FIELDS ────────────────────────────────────────────────────────────

    private String extractIdentifier(Element root) {
        NodeList stamps = root.getElementsByTagNameNS(CfdiSchema.STAMP_NAMESPACE, "TimbreFiscalDigital");
        if (stamps.getLength() == 0) {
            return "";
        }
        return ((Element) stamps.item(0)).getAttribute("UUID");
    }

    private String extractIssuerTaxId(Element root, CfdiSchema schema) {
        for (Element issuer : children(root, schema, "Emisor")) {
            for (String attribute : ISSUER_TAX_ID_ATTRIBUTES) {
                String value = issuer.getAttribute(attribute);
                if (!value.isBlank()) {
                    return value;
                }
            }
            return "";
        }
        return "";
    }

    /**
     * Sums {@code Importe} over every {@code Traslados/Traslado} whose {@code Impuesto} is IVA.
     * Other taxes are ignored; unreadable amounts are skipped.
     */
    private BigDecimal sumValueAddedTax(Element root, CfdiSchema schema, String sourceFileName) {
        BigDecimal sum = BigDecimal.ZERO;
        for (Element transfer : descendants(root, schema, "Traslado")) {
            Node parent = transfer.getParentNode();
            if (parent == null || !"Traslados".equals(parent.getLocalName())) continue;

            String taxCode = transfer.getAttribute("Impuesto").trim();
            if (!VAT_TAX_CODES.contains(taxCode)) continue;

            String amount = transfer.getAttribute("Importe").trim();
            if (amount.isEmpty()) continue;
            try {
                sum = sum.add(new BigDecimal(amount));
            } catch (NumberFormatException e) {
                log.debug("{}: skipping non-numeric Importe '{}'", sourceFileName, amount);
            }
        }
        return sum;
    }

    private LocalDate parseIssueDate(String raw) {
        if (raw == null || raw.length() < 10) {
            return CanonicalInvoiceRecord.UNKNOWN_ISSUE_DATE;
        }
        try {
            return LocalDate.parse(raw.substring(0, 10));
        } catch (DateTimeParseException e) {
            return CanonicalInvoiceRecord.UNKNOWN_ISSUE_DATE;
        }
    }

    // ─── HELPERS ───────────────────────────────────────────────────────────

    private static List<Element> children(Element parent, CfdiSchema schema, String localName) {
        List<Element> result = new ArrayList<>();
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() == Node.ELEMENT_NODE
                    && localName.equals(node.getLocalName())
                    && schema.getNamespaces().contains(node.getNamespaceURI())) {
                result.add((Element) node);
            }
        }
        return result;
    }

    private static List<Element> descendants(Element root, CfdiSchema schema, String localName) {
        List<Element> result = new ArrayList<>();
        for (String ns : schema.getNamespaces()) {
            NodeList nodes = root.getElementsByTagNameNS(ns, localName);
            for (int i = 0; i < nodes.getLength(); i++) {
                result.add((Element) nodes.item(i));
            }
        }
        return result;
    }

    private static String nonBlankOr(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static class InvalidCfdiException extends Exception {
        InvalidCfdiException(String message) {
            super(message);
        }
    }
}
