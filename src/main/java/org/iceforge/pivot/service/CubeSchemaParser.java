package org.iceforge.pivot.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.pivot.error.SchemaException;
import org.iceforge.pivot.model.Aggregator;
import org.iceforge.pivot.model.Cube;
import org.iceforge.pivot.model.CubeDef;
import org.iceforge.pivot.model.Dimension;
import org.iceforge.pivot.model.DimensionDef;
import org.iceforge.pivot.model.Level;
import org.iceforge.pivot.model.LevelDef;
import org.iceforge.pivot.model.Measure;
import org.iceforge.pivot.model.MeasureDef;
import org.iceforge.pivot.model.SchemaDef;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads a cube schema document into immutable {@link Cube} values.
 * <p>
 * Two surface syntaxes are accepted: the Mondrian 3 XML dialect
 * ({@code Schema/Cube/Table, Dimension/Hierarchy/Level, Measure}) and a YAML document with
 * the same tree. Both are first read into {@link SchemaDef} and then validated as a whole;
 * any problem fails the entire document so nothing is ever partially registered.
 */
@Component
public class CubeSchemaParser {

    private final ObjectMapper yamlMapper;

    public CubeSchemaParser(@Qualifier("yamlObjectMapper") ObjectMapper yamlObjectMapper) {
        this.yamlMapper = Objects.requireNonNull(yamlObjectMapper);
    }

    public List<Cube> parse(String content) {
        return parse(content, SchemaFormat.detect(content));
    }

    public List<Cube> parse(String content, SchemaFormat format) {
        if (!StringUtils.hasText(content)) {
            throw new SchemaException("Schema document is empty");
        }
        SchemaDef def = format == SchemaFormat.XML ? readXml(content) : readYaml(content);
        return toCubes(def);
    }

    SchemaDef readYaml(String content) {
        try {
            SchemaDef def = yamlMapper.readValue(content, SchemaDef.class);
            if (def == null) {
                throw new SchemaException("Schema document is empty");
            }
            return def;
        } catch (JsonProcessingException e) {
            throw new SchemaException("Schema document is not well-formed YAML: " + e.getOriginalMessage(), e);
        }
    }

    // ---- XML ---------------------------------------------------------------------------------

    SchemaDef readXml(String content) {
        Element root = parseDocument(content).getDocumentElement();
        List<Element> cubeElems;
        Map<String, Element> sharedDims = new LinkedHashMap<>();
        if ("Cube".equals(localName(root))) {
            cubeElems = List.of(root);
        } else if ("Schema".equals(localName(root))) {
            cubeElems = children(root, "Cube");
            for (Element shared : children(root, "Dimension")) {
                sharedDims.put(shared.getAttribute("name"), shared);
            }
        } else {
            throw new SchemaException("Root element must be <Schema> or <Cube>, found <" + localName(root) + ">");
        }

        SchemaDef def = new SchemaDef();
        def.setName(attr(root, "name"));
        List<CubeDef> cubes = new ArrayList<>();
        for (Element cubeElem : cubeElems) {
            cubes.add(readCube(cubeElem, sharedDims));
        }
        def.setCubes(cubes);
        return def;
    }

    private CubeDef readCube(Element cubeElem, Map<String, Element> sharedDims) {
        CubeDef cube = new CubeDef();
        cube.setName(attr(cubeElem, "name"));
        cube.setCaption(attr(cubeElem, "caption"));
        Element table = firstChild(cubeElem, "Table");
        if (table != null) {
            cube.setFactTable(qualifiedTable(table));
        }

        List<DimensionDef> dims = new ArrayList<>();
        for (Element child : children(cubeElem, null)) {
            String tag = localName(child);
            if ("Dimension".equals(tag)) {
                dims.add(readDimension(child, attr(child, "name"), attr(child, "foreignKey"), cube));
            } else if ("DimensionUsage".equals(tag)) {
                dims.add(readDimensionUsage(child, sharedDims, cube));
            }
        }
        cube.setDimensions(dims);

        List<MeasureDef> measures = new ArrayList<>();
        for (Element m : children(cubeElem, "Measure")) {
            MeasureDef measure = new MeasureDef();
            measure.setName(attr(m, "name"));
            measure.setColumn(attr(m, "column"));
            measure.setAggregator(attr(m, "aggregator"));
            measure.setFormatString(attr(m, "formatString"));
            measure.setCaption(attr(m, "caption"));
            measures.add(measure);
        }
        cube.setMeasures(measures);
        return cube;
    }

    private DimensionDef readDimension(Element dimElem, String name, String foreignKey, CubeDef cube) {
        DimensionDef dim = new DimensionDef();
        dim.setName(name);
        dim.setCaption(attr(dimElem, "caption"));
        dim.setForeignKey(foreignKey);

        List<Element> hierarchies = children(dimElem, "Hierarchy");
        if (hierarchies.size() > 1) {
            throw new SchemaException("Dimension '" + name + "' in cube '" + cube.getName()
                    + "' declares " + hierarchies.size() + " hierarchies; only one is supported");
        }
        Element levelParent = hierarchies.isEmpty() ? dimElem : hierarchies.get(0);
        if (!hierarchies.isEmpty()) {
            dim.setPrimaryKey(attr(levelParent, "primaryKey"));
        }
        Element table = firstChild(levelParent, "Table");
        if (table != null) {
            dim.setTable(qualifiedTable(table));
        } else {
            // no table: a degenerate dimension on the fact table
            dim.setTable(attr(dimElem, "table"));
        }

        List<LevelDef> levels = new ArrayList<>();
        for (Element l : children(levelParent, "Level")) {
            LevelDef level = new LevelDef();
            level.setName(attr(l, "name"));
            level.setColumn(attr(l, "column"));
            level.setOrdinalColumn(attr(l, "ordinalColumn"));
            level.setCaption(attr(l, "caption"));
            levels.add(level);
        }
        dim.setLevels(levels);
        return dim;
    }

    private DimensionDef readDimensionUsage(Element usage, Map<String, Element> sharedDims, CubeDef cube) {
        String name = attr(usage, "name");
        String source = attr(usage, "source");
        if (source == null) {
            source = name;
        }
        Element shared = sharedDims.get(source);
        if (shared != null) {
            return readDimension(shared, name, attr(usage, "foreignKey"), cube);
        }
        // unresolved usage: single level named after the dimension over a table named after the source
        DimensionDef dim = new DimensionDef();
        dim.setName(name);
        dim.setCaption(attr(usage, "caption"));
        dim.setForeignKey(attr(usage, "foreignKey"));
        dim.setTable(source == null ? null : source.toLowerCase(Locale.ROOT));
        LevelDef level = new LevelDef();
        level.setName(name);
        level.setColumn(name == null ? null : name.toLowerCase(Locale.ROOT));
        dim.setLevels(List.of(level));
        return dim;
    }

    private static Document parseDocument(String content) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new ThrowingErrorHandler());
            Document doc = builder.parse(new InputSource(new StringReader(content)));
            doc.getDocumentElement().normalize();
            return doc;
        } catch (SAXException e) {
            throw new SchemaException("Schema document is not well-formed XML: " + e.getMessage(), e);
        } catch (ParserConfigurationException | IOException e) {
            throw new SchemaException("Failed to read schema document: " + e.getMessage(), e);
        }
    }

    private static String qualifiedTable(Element table) {
        String name = attr(table, "name");
        String schema = attr(table, "schema");
        if (name == null) {
            return null;
        }
        return schema == null ? name : schema + "." + name;
    }

    private static String localName(Node node) {
        return node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
    }

    private static String attr(Element e, String name) {
        String v = e.getAttribute(name);
        return StringUtils.hasText(v) ? v.trim() : null;
    }

    private static Element firstChild(Element parent, String tag) {
        List<Element> found = children(parent, tag);
        return found.isEmpty() ? null : found.get(0);
    }

    private static List<Element> children(Element parent, String tag) {
        List<Element> out = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node n = nodes.item(i);
            if (n.getNodeType() == Node.ELEMENT_NODE && (tag == null || tag.equals(localName(n)))) {
                out.add((Element) n);
            }
        }
        return out;
    }

    private static final class ThrowingErrorHandler implements ErrorHandler {
        @Override
        public void warning(SAXParseException e) {
            // warnings do not make a document invalid
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    }

    // ---- validation --------------------------------------------------------------------------

    List<Cube> toCubes(SchemaDef def) {
        if (def.getCubes() == null || def.getCubes().isEmpty()) {
            throw new SchemaException("Schema declares no cubes");
        }
        Set<String> cubeNames = new HashSet<>();
        List<Cube> cubes = new ArrayList<>();
        for (CubeDef c : def.getCubes()) {
            if (!StringUtils.hasText(c.getName())) {
                throw new SchemaException("Cube without a name");
            }
            if (!cubeNames.add(c.getName())) {
                throw new SchemaException("Duplicate cube name '" + c.getName() + "'");
            }
            cubes.add(toCube(c));
        }
        return List.copyOf(cubes);
    }

    private Cube toCube(CubeDef c) {
        String cubeName = c.getName();
        if (!StringUtils.hasText(c.getFactTable())) {
            throw new SchemaException("Cube '" + cubeName + "' has no fact table");
        }
        String factTable = c.getFactTable().trim();

        List<Dimension> dimensions = new ArrayList<>();
        Set<String> dimNames = new HashSet<>();
        for (DimensionDef d : nullSafe(c.getDimensions())) {
            if (!StringUtils.hasText(d.getName())) {
                throw new SchemaException("Cube '" + cubeName + "' has a dimension without a name");
            }
            if (!dimNames.add(d.getName())) {
                throw new SchemaException("Duplicate dimension '" + d.getName() + "' in cube '" + cubeName + "'");
            }
            dimensions.add(toDimension(cubeName, factTable, d));
        }

        List<Measure> measures = new ArrayList<>();
        Set<String> measureNames = new HashSet<>();
        for (MeasureDef m : nullSafe(c.getMeasures())) {
            if (!StringUtils.hasText(m.getName())) {
                throw new SchemaException("Cube '" + cubeName + "' has a measure without a name");
            }
            if (!measureNames.add(m.getName())) {
                throw new SchemaException("Duplicate measure '" + m.getName() + "' in cube '" + cubeName + "'");
            }
            if (!StringUtils.hasText(m.getColumn())) {
                throw new SchemaException("Measure '" + m.getName() + "' in cube '" + cubeName + "' has no column");
            }
            Aggregator agg = m.getAggregator() == null
                    ? Aggregator.SUM
                    : Aggregator.fromSchemaName(m.getAggregator()).orElseThrow(() -> new SchemaException(
                            "Measure '" + m.getName() + "' in cube '" + cubeName + "' has unsupported aggregator '"
                                    + m.getAggregator() + "'; expected one of sum, count, avg, min, max, distinct-count"));
            measures.add(new Measure(m.getName(), m.getColumn().trim(), agg, m.getFormatString(), m.getCaption()));
        }

        return new Cube(cubeName, factTable, dimensions, measures, c.getCaption());
    }

    private Dimension toDimension(String cubeName, String factTable, DimensionDef d) {
        String where = "dimension '" + d.getName() + "' in cube '" + cubeName + "'";
        String table = StringUtils.hasText(d.getTable()) ? d.getTable().trim() : factTable;
        if (!table.equals(factTable) && !StringUtils.hasText(d.getForeignKey())) {
            throw new SchemaException("No foreignKey on " + where + " joined to table '" + table + "'");
        }
        List<LevelDef> levelDefs = nullSafe(d.getLevels());
        if (levelDefs.isEmpty()) {
            throw new SchemaException("Hierarchy of " + where + " has no levels");
        }
        List<Level> levels = new ArrayList<>();
        Set<String> levelNames = new HashSet<>();
        for (LevelDef l : levelDefs) {
            if (!StringUtils.hasText(l.getName())) {
                throw new SchemaException("Level without a name on " + where);
            }
            if (!levelNames.add(l.getName())) {
                throw new SchemaException("Duplicate level '" + l.getName() + "' on " + where);
            }
            String column = StringUtils.hasText(l.getColumn())
                    ? l.getColumn().trim()
                    : l.getName().trim().toLowerCase(Locale.ROOT).replace(' ', '_');
            levels.add(new Level(l.getName(), column, emptyToNull(l.getOrdinalColumn()), l.getCaption()));
        }
        String foreignKey = table.equals(factTable) ? emptyToNull(d.getForeignKey()) : d.getForeignKey().trim();
        return new Dimension(d.getName(), table, foreignKey, emptyToNull(d.getPrimaryKey()), levels, d.getCaption());
    }

    private static String emptyToNull(String s) {
        return StringUtils.hasText(s) ? s.trim() : null;
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? List.of() : list;
    }
}
