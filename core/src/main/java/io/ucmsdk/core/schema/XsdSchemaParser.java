package io.ucmsdk.core.schema;

import io.ucmsdk.core.engine.ValueCoercion;
import io.ucmsdk.core.error.SchemaParseException;
import io.ucmsdk.core.model.ApiVersion;
import io.ucmsdk.core.model.FieldSpec;
import io.ucmsdk.core.model.OperationSchema;
import io.ucmsdk.core.model.PrimitiveType;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

/**
 * Derives {@link OperationSchema}s from an XML Schema, bare or embedded in a
 * WSDL {@code types} section.
 *
 * <p>
 * Operations follow the AXL naming convention: a top-level element {@code X}
 * with a sibling {@code XResponse} defines operation {@code X}. Only the
 * schema subset AXL actually uses is supported; {@code any}, {@code group},
 * {@code redefine}, {@code union} and {@code list} are rejected with a
 * {@link SchemaParseException} rather than approximated.
 *
 * <p>
 * {@code xsd:include}, {@code xsd:import} and {@code wsdl:import} with a
 * location are read from the file system, relative to the location of the
 * document that names them. A {@code sequence} inside a {@code choice} becomes
 * one alternative whose members share a {@link FieldSpec#choiceBranch()}.
 * The {@code maxLength} facet is kept; other facets are not.
 *
 * <p>
 * When the source carries no API version it is taken from the trailing
 * segment of the schema's {@code targetNamespace}
 * ({@code http://www.cisco.com/AXL/API/14.0}).
 */
public final class XsdSchemaParser implements SchemaParser {

    static final String XSD_NS = XMLConstants.W3C_XML_SCHEMA_NS_URI;
    static final String WSDL_NS = "http://schemas.xmlsoap.org/wsdl/";

    private static final Set<String> UNSUPPORTED = Set.of("any", "group", "redefine", "union", "list");

    private static final Map<String, PrimitiveType> BUILT_INS = builtIns();

    @Override
    public List<OperationSchema> parse(SchemaSource source) {
        Set<String> visited = new HashSet<>();
        visited.add(normalizedLocation(source.location()));
        List<Element> schemas = new ArrayList<>();
        collectSchemas(source.content(), source.location(), source, visited, schemas);
        if (schemas.isEmpty()) {
            throw new SchemaParseException(
                    "WSDL has no embedded xsd:schema in its types section", source.apiVersion(), source.location());
        }
        String apiVersion = resolveVersion(schemas, source);

        Context ctx = new Context(apiVersion, source.location());
        for (Element schema : schemas) {
            rejectUnsupported(ctx, schema);
            for (Element child : children(schema)) {
                String name = child.getAttribute("name");
                switch (child.getLocalName()) {
                    case "element" -> ctx.elements.put(name, child);
                    case "complexType" -> ctx.complexTypes.put(name, child);
                    case "simpleType" -> ctx.simpleTypes.put(name, child);
                    default -> {
                        // annotations and attribute declarations carry no operation shape
                    }
                }
            }
        }

        List<OperationSchema> operations = new ArrayList<>();
        for (Map.Entry<String, Element> entry : ctx.elements.entrySet()) {
            String operation = entry.getKey();
            Element response = ctx.elements.get(operation + "Response");
            if (operation.endsWith("Response") || response == null) {
                continue;
            }
            operations.add(new OperationSchema(
                    operation,
                    apiVersion,
                    rootOf(ctx, operation, entry.getValue()),
                    rootOf(ctx, operation + "Response", response)));
        }
        if (operations.isEmpty()) {
            throw ctx.error("Schema defines no operations (no element X with a matching XResponse)");
        }
        return operations;
    }

    private FieldSpec rootOf(Context ctx, String name, Element element) {
        FieldSpec.Builder builder = FieldSpec.builder(name);
        applyElementType(ctx, builder, element, name);
        FieldSpec root = ctx.build(builder, name);
        if (!root.isObject()) {
            throw ctx.error("Operation element '" + name + "' must have complex content");
        }
        return root;
    }

    private FieldSpec elementField(
            Context ctx, Element element, String path, String choiceGroup, String choiceBranch, boolean choiceRequired) {
        Element declaration = element;
        if (element.hasAttribute("ref")) {
            String refName = localName(element.getAttribute("ref"));
            declaration = ctx.elements.get(refName);
            if (declaration == null) {
                throw ctx.error("Element '" + path + "' references unknown element '" + refName + "'");
            }
        }
        String name = declaration.getAttribute("name");
        if (name.isEmpty()) {
            throw ctx.error("Element under '" + path + "' has neither 'name' nor 'ref'");
        }
        String fieldPath = path.isEmpty() ? name : path + "." + name;

        FieldSpec.Builder builder = FieldSpec.builder(name);
        if (declaration != element) {
            String marker = "element " + name;
            if (ctx.expanding.contains(marker)) {
                throw ctx.error("Element '" + name + "' is recursive (via '" + fieldPath + "'); recursive types are not supported");
            }
            ctx.expanding.push(marker);
            try {
                applyElementType(ctx, builder, declaration, fieldPath);
            } finally {
                ctx.expanding.pop();
            }
        } else {
            applyElementType(ctx, builder, declaration, fieldPath);
        }

        int minOccurs = occurs(ctx, element.getAttribute("minOccurs"), fieldPath);
        int maxOccurs = occurs(ctx, element.getAttribute("maxOccurs"), fieldPath);
        builder.repeated(maxOccurs > 1);
        if (choiceGroup != null) {
            builder.choiceGroup(choiceGroup).choiceBranch(choiceBranch).required(choiceRequired);
        } else {
            builder.required(minOccurs >= 1);
        }
        String defaultValue = element.hasAttribute("default") ? element.getAttribute("default") : declaration.getAttribute("default");
        if (!defaultValue.isEmpty()) {
            builder.defaultValue(defaultValue);
        }
        String doc = documentation(declaration);
        if (doc != null) {
            builder.description(doc);
        }
        return ctx.build(builder, fieldPath);
    }

    private void applyElementType(Context ctx, FieldSpec.Builder builder, Element element, String path) {
        if (element.hasAttribute("type")) {
            applyTypeRef(ctx, builder, element, element.getAttribute("type"), path);
            return;
        }
        Element complex = firstChild(element, "complexType");
        Element simple = firstChild(element, "simpleType");
        if (complex != null) {
            applyComplexType(ctx, builder, complex, path);
        } else if (simple != null) {
            applySimpleType(ctx, builder, simple, path);
        } else {
            // untyped elements are xsd:anyType; AXL uses them for free text
            builder.primitive(PrimitiveType.STRING);
        }
    }

    private void applyTypeRef(Context ctx, FieldSpec.Builder builder, Element context, String qname, String path) {
        String local = localName(qname);
        if (isBuiltIn(context, qname)) {
            PrimitiveType primitive = BUILT_INS.get(local);
            if (primitive == null) {
                throw ctx.error("Unsupported built-in type 'xsd:" + local + "' at '" + path + "'");
            }
            builder.primitive(primitive);
            return;
        }
        Element simple = ctx.simpleTypes.get(local);
        if (simple != null) {
            String marker = "simpleType " + local;
            if (ctx.expanding.contains(marker)) {
                throw ctx.error("Type '" + local + "' is recursive (via '" + path + "'); recursive types are not supported");
            }
            ctx.expanding.push(marker);
            try {
                applySimpleType(ctx, builder, simple, path);
            } finally {
                ctx.expanding.pop();
            }
            return;
        }
        Element complex = ctx.complexTypes.get(local);
        if (complex == null) {
            throw ctx.error("Unknown type '" + qname + "' at '" + path + "'");
        }
        if (ctx.expanding.contains(local)) {
            throw ctx.error("Type '" + local + "' is recursive (via '" + path + "'); recursive types are not supported");
        }
        ctx.expanding.push(local);
        try {
            applyComplexType(ctx, builder, complex, path);
        } finally {
            ctx.expanding.pop();
        }
    }

    private void applySimpleType(Context ctx, FieldSpec.Builder builder, Element simpleType, String path) {
        Element restriction = firstChild(simpleType, "restriction");
        if (restriction == null) {
            throw ctx.error("simpleType at '" + path + "' must be a restriction");
        }
        List<String> values = new ArrayList<>();
        for (Element facet : children(restriction)) {
            if ("enumeration".equals(facet.getLocalName())) {
                values.add(facet.getAttribute("value"));
            }
        }
        if (!values.isEmpty()) {
            builder.enumeration(values);
            return;
        }
        if (restriction.hasAttribute("base")) {
            applyTypeRef(ctx, builder, restriction, restriction.getAttribute("base"), path);
        } else {
            Element inline = firstChild(restriction, "simpleType");
            if (inline == null) {
                throw ctx.error("restriction at '" + path + "' has no base type");
            }
            applySimpleType(ctx, builder, inline, path);
        }
        Element maxLength = firstChild(restriction, "maxLength");
        if (maxLength != null) {
            // applied after the base, so a derived type overrides its base limit
            builder.maxLength(lengthFacet(ctx, maxLength.getAttribute("value"), path));
        }
    }

    private static int lengthFacet(Context ctx, String value, String path) {
        try {
            int length = Integer.parseInt(value.trim());
            if (length >= 1) {
                return length;
            }
        } catch (NumberFormatException e) {
            throw new SchemaParseException(
                    "Invalid maxLength '" + value + "' at '" + path + "'", e, ctx.apiVersion, ctx.location);
        }
        throw ctx.error("Invalid maxLength '" + value + "' at '" + path + "'; must be at least 1");
    }

    private void applyComplexType(Context ctx, FieldSpec.Builder builder, Element complexType, String path) {
        Element simpleContent = firstChild(complexType, "simpleContent");
        if (simpleContent != null) {
            Element derivation = firstDerivation(ctx, simpleContent, path);
            // attributes on simple content are dropped; the value is what callers send and read
            applyTypeRef(ctx, builder, derivation, derivation.getAttribute("base"), path);
            return;
        }
        List<FieldSpec> fields = new ArrayList<>();
        collectContent(ctx, complexType, path, fields);
        builder.object(fields);
    }

    private void collectContent(Context ctx, Element container, String path, List<FieldSpec> fields) {
        for (Element child : children(container)) {
            switch (child.getLocalName()) {
                case "sequence", "all" -> collectParticles(ctx, child, path, fields);
                case "choice" -> collectChoice(ctx, child, path, fields);
                case "attribute" -> fields.add(attributeField(ctx, child, path));
                case "complexContent" -> {
                    Element derivation = firstDerivation(ctx, child, path);
                    if ("extension".equals(derivation.getLocalName())) {
                        String base = localName(derivation.getAttribute("base"));
                        Element baseType = ctx.complexTypes.get(base);
                        if (baseType == null) {
                            throw ctx.error("Unknown base type '" + base + "' at '" + path + "'");
                        }
                        if (ctx.expanding.contains(base)) {
                            throw ctx.error("Type '" + base + "' is recursive (via '" + path + "')");
                        }
                        ctx.expanding.push(base);
                        try {
                            collectContent(ctx, baseType, path, fields);
                        } finally {
                            ctx.expanding.pop();
                        }
                    }
                    collectContent(ctx, derivation, path, fields);
                }
                default -> {
                    // annotation, anyAttribute and similar carry no fields
                }
            }
        }
    }

    private void collectParticles(Context ctx, Element group, String path, List<FieldSpec> fields) {
        for (Element particle : children(group)) {
            switch (particle.getLocalName()) {
                case "element" -> fields.add(elementField(ctx, particle, path, null, null, false));
                case "sequence" -> collectParticles(ctx, particle, path, fields);
                case "choice" -> collectChoice(ctx, particle, path, fields);
                default -> {
                    // annotation
                }
            }
        }
    }

    private void collectChoice(Context ctx, Element choice, String path, List<FieldSpec> fields) {
        String group = "choice" + (++ctx.choiceCounter);
        boolean required = occurs(ctx, choice.getAttribute("minOccurs"), path) >= 1;
        for (Element member : children(choice)) {
            switch (member.getLocalName()) {
                case "element" -> required &= occurs(ctx, member.getAttribute("minOccurs"), path) >= 1;
                case "sequence" -> required &= !isEmptiable(ctx, member, path);
                case "annotation" -> {
                    // no fields
                }
                default -> throw ctx.error("Unsupported '" + member.getLocalName() + "' inside choice at '"
                        + (path.isEmpty() ? "<root>" : path) + "'; only elements and sequences are supported");
            }
        }
        int branches = 0;
        for (Element member : children(choice)) {
            if ("element".equals(member.getLocalName())) {
                fields.add(elementField(ctx, member, path, group, null, required));
            } else if ("sequence".equals(member.getLocalName())) {
                String branch = group + "." + (++branches);
                for (Element particle : children(member)) {
                    switch (particle.getLocalName()) {
                        case "element" -> fields.add(elementField(ctx, particle, path, group, branch, required));
                        case "annotation" -> {
                            // no fields
                        }
                        default -> throw ctx.error("Unsupported '" + particle.getLocalName()
                                + "' inside a choice branch at '" + (path.isEmpty() ? "<root>" : path)
                                + "'; only elements are supported");
                    }
                }
            }
        }
    }

    /** {@code true} if a choice branch may legally contain nothing. */
    private static boolean isEmptiable(Context ctx, Element sequence, String path) {
        if (occurs(ctx, sequence.getAttribute("minOccurs"), path) == 0) {
            return true;
        }
        for (Element particle : children(sequence)) {
            if ("element".equals(particle.getLocalName())
                    && occurs(ctx, particle.getAttribute("minOccurs"), path) >= 1) {
                return false;
            }
        }
        return true;
    }

    private FieldSpec attributeField(Context ctx, Element attribute, String path) {
        String name = attribute.getAttribute("name");
        if (name.isEmpty()) {
            throw ctx.error("Attribute under '" + path + "' has no name");
        }
        String fieldPath = path.isEmpty() ? name : path + "." + name;
        FieldSpec.Builder builder = FieldSpec.builder(name);
        if (attribute.hasAttribute("type")) {
            applyTypeRef(ctx, builder, attribute, attribute.getAttribute("type"), fieldPath);
        } else {
            Element simple = firstChild(attribute, "simpleType");
            if (simple != null) {
                applySimpleType(ctx, builder, simple, fieldPath);
            } else {
                builder.primitive(PrimitiveType.STRING);
            }
        }
        builder.required("required".equals(attribute.getAttribute("use")));
        if (attribute.hasAttribute("default")) {
            builder.defaultValue(attribute.getAttribute("default"));
        }
        FieldSpec field = ctx.build(builder, fieldPath);
        if (field.isObject()) {
            throw ctx.error("Attribute '" + fieldPath + "' must have a simple type");
        }
        return field;
    }

    private Element firstDerivation(Context ctx, Element content, String path) {
        for (Element child : children(content)) {
            if ("extension".equals(child.getLocalName()) || "restriction".equals(child.getLocalName())) {
                return child;
            }
        }
        throw ctx.error("Content model at '" + path + "' has no extension or restriction");
    }

    private static int occurs(Context ctx, String value, String path) {
        if (value == null || value.isEmpty()) {
            return 1;
        }
        if ("unbounded".equals(value)) {
            return Integer.MAX_VALUE;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new SchemaParseException(
                    "Invalid occurrence '" + value + "' at '" + path + "'", e, ctx.apiVersion, ctx.location);
        }
    }

    private static void rejectUnsupported(Context ctx, Element schema) {
        NodeList all = schema.getElementsByTagNameNS(XSD_NS, "*");
        for (int i = 0; i < all.getLength(); i++) {
            String name = all.item(i).getLocalName();
            if (UNSUPPORTED.contains(name)) {
                throw ctx.error("Unsupported schema construct 'xsd:" + name + "'");
            }
        }
    }

    /**
     * Reads a document and appends its schemas, followed by the schemas it
     * includes or imports, to {@code out}. Each file is read once.
     */
    private static void collectSchemas(
            String content, String location, SchemaSource source, Set<String> visited, List<Element> out) {
        Element root = readDocument(content, source.apiVersion(), location).getDocumentElement();
        List<Element> own = new ArrayList<>();
        List<String> references = new ArrayList<>();
        if (XSD_NS.equals(root.getNamespaceURI()) && "schema".equals(root.getLocalName())) {
            own.add(root);
        } else if (WSDL_NS.equals(root.getNamespaceURI()) && "definitions".equals(root.getLocalName())) {
            for (Element child : children(root)) {
                if ("types".equals(child.getLocalName())) {
                    for (Element schema : children(child)) {
                        if (XSD_NS.equals(schema.getNamespaceURI()) && "schema".equals(schema.getLocalName())) {
                            own.add(schema);
                        }
                    }
                } else if ("import".equals(child.getLocalName()) && child.hasAttribute("location")) {
                    references.add(child.getAttribute("location"));
                }
            }
        } else {
            throw new SchemaParseException("Document root must be xsd:schema or wsdl:definitions but was '"
                    + root.getNodeName() + "'", source.apiVersion(), location);
        }
        for (Element schema : own) {
            for (Element child : children(schema)) {
                String kind = child.getLocalName();
                // a namespace-only import brings no declarations of its own
                if (("include".equals(kind) || "import".equals(kind)) && child.hasAttribute("schemaLocation")) {
                    references.add(child.getAttribute("schemaLocation"));
                }
            }
        }
        out.addAll(own);
        for (String reference : references) {
            Path target = resolveReference(location, reference, source);
            if (visited.add(target.toString())) {
                collectSchemas(readReferenced(target, source), target.toString(), source, visited, out);
            }
        }
    }

    private static Path resolveReference(String location, String reference, SchemaSource source) {
        if (reference.contains("://")) {
            throw new SchemaParseException(
                    "Remote schema reference '" + reference + "' is not supported; place it next to the WSDL",
                    source.apiVersion(),
                    location);
        }
        try {
            return Path.of(location).toAbsolutePath().resolveSibling(reference).normalize();
        } catch (InvalidPathException e) {
            throw new SchemaParseException(
                    "Cannot resolve schema reference '" + reference + "'", e, source.apiVersion(), location);
        }
    }

    private static String readReferenced(Path target, SchemaSource source) {
        if (!Files.isRegularFile(target)) {
            throw new SchemaParseException(
                    "Referenced schema not found: " + target, source.apiVersion(), source.location());
        }
        try {
            return Files.readString(target, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SchemaParseException(
                    "Failed to read referenced schema: " + e.getMessage(), e, source.apiVersion(), target.toString());
        }
    }

    private static String normalizedLocation(String location) {
        try {
            return Path.of(location).toAbsolutePath().normalize().toString();
        } catch (InvalidPathException e) {
            return location;
        }
    }

    private static String resolveVersion(List<Element> schemas, SchemaSource source) {
        String candidate = source.apiVersion();
        if (candidate == null) {
            for (Element schema : schemas) {
                String namespace = schema.getAttribute("targetNamespace");
                String tail = namespace.substring(namespace.lastIndexOf('/') + 1);
                if (ApiVersion.isValid(tail)) {
                    candidate = tail;
                    break;
                }
            }
        }
        if (candidate == null || !ApiVersion.isValid(candidate)) {
            throw new SchemaParseException("Cannot determine the API version of the schema; pass it with the source",
                    source.apiVersion(), source.location());
        }
        return ApiVersion.normalize(candidate);
    }

    private static Document readDocument(String content, String apiVersion, String location) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(content)));
        } catch (SAXException e) {
            throw new SchemaParseException("Malformed XML schema: " + e.getMessage(), e, apiVersion, location);
        } catch (ParserConfigurationException | IOException e) {
            throw new SchemaParseException("Failed to read XML schema: " + e.getMessage(), e, apiVersion, location);
        }
    }

    private static boolean isBuiltIn(Element context, String qname) {
        int colon = qname.indexOf(':');
        String prefix = colon < 0 ? null : qname.substring(0, colon);
        return XSD_NS.equals(context.lookupNamespaceURI(prefix));
    }

    private static String localName(String qname) {
        return qname.substring(qname.indexOf(':') + 1);
    }

    private static String documentation(Element element) {
        Element annotation = firstChild(element, "annotation");
        Element doc = annotation != null ? firstChild(annotation, "documentation") : null;
        if (doc == null) {
            return null;
        }
        String text = doc.getTextContent().trim();
        return text.isEmpty() ? null : text;
    }

    private static Element firstChild(Element parent, String localName) {
        for (Element child : children(parent)) {
            if (localName.equals(child.getLocalName())) {
                return child;
            }
        }
        return null;
    }

    private static List<Element> children(Element parent) {
        List<Element> result = new ArrayList<>();
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                result.add((Element) node);
            }
        }
        return result;
    }

    private static Map<String, PrimitiveType> builtIns() {
        Map<String, PrimitiveType> map = new LinkedHashMap<>();
        for (String name : List.of("string", "normalizedString", "token", "anyURI", "time", "NMTOKEN", "ID",
                "IDREF", "Name", "NCName", "language")) {
            map.put(name, PrimitiveType.STRING);
        }
        for (String name : List.of("int", "integer", "long", "short", "byte", "nonNegativeInteger",
                "positiveInteger", "nonPositiveInteger", "negativeInteger", "unsignedInt", "unsignedLong",
                "unsignedShort", "unsignedByte")) {
            map.put(name, PrimitiveType.INTEGER);
        }
        for (String name : List.of("decimal", "double", "float")) {
            map.put(name, PrimitiveType.DECIMAL);
        }
        map.put("boolean", PrimitiveType.BOOLEAN);
        map.put("dateTime", PrimitiveType.DATE_TIME);
        map.put("date", PrimitiveType.DATE);
        return Map.copyOf(map);
    }

    /** Per-parse state: top-level declarations by name and the type expansion stack. */
    private static final class Context {
        final String apiVersion;
        final String location;
        final Map<String, Element> elements = new LinkedHashMap<>();
        final Map<String, Element> complexTypes = new LinkedHashMap<>();
        final Map<String, Element> simpleTypes = new LinkedHashMap<>();
        final Deque<String> expanding = new ArrayDeque<>();
        int choiceCounter;

        Context(String apiVersion, String location) {
            this.apiVersion = apiVersion;
            this.location = location;
        }

        FieldSpec build(FieldSpec.Builder builder, String path) {
            FieldSpec field;
            try {
                field = builder.build();
            } catch (IllegalArgumentException e) {
                throw new SchemaParseException("Invalid element '" + path + "': " + e.getMessage(), e, apiVersion, location);
            }
            if (field.defaultValue() != null) {
                try {
                    ValueCoercion.coerceDefault(field);
                } catch (IllegalArgumentException e) {
                    throw new SchemaParseException(
                            "Invalid default for '" + path + "': " + e.getMessage(), e, apiVersion, location);
                }
            }
            return field;
        }

        SchemaParseException error(String message) {
            return new SchemaParseException(message, apiVersion, location);
        }
    }
}
