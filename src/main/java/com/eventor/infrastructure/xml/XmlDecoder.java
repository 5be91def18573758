package com.eventor.infrastructure.xml;

import com.eventor.domain.mapping.SearchMode;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decodes XML documents into annotated records.
 * <p>
 * The document is parsed once into a tree; nested records are decoded from subtrees of it.
 * Decoding has no side effects: the same bytes always give the same entity or the same failure.
 * Mapping tables are cached per record type and never change after they are built, so one
 * decoder can be shared between threads.
 */
public class XmlDecoder {

    private final Map<Class<?>, EntityModel> models = new ConcurrentHashMap<>();

    /**
     * Parses a whole document and decodes its root element.
     *
     * @throws XmlDecodingException if the document is empty, its root tag differs from the one
     *                              declared on {@code type}, or any field cannot be decoded
     */
    public <T> T decode(byte[] xml, Class<T> type) throws XmlDecodingException {
        EntityModel model = modelFor(type);
        Document document;
        try {
            document = Jsoup.parse(new ByteArrayInputStream(xml), null, "", Parser.xmlParser());
        } catch (IOException e) {
            throw new XmlDecodingException("Unreadable document", type.getSimpleName(), e);
        }

        Element root = document.children().first();
        if (root == null) {
            throw new XmlDecodingException("Empty document", type.getSimpleName());
        }
        if (model.tag() != null && !model.tag().equals(root.tagName())) {
            throw new XmlDecodingException(
                "Expected root <" + model.tag() + "> but found <" + root.tagName() + ">", root.tagName());
        }
        return type.cast(decodeEntity(root, model, root.tagName()));
    }

    /**
     * Decodes an element that is already part of a parsed tree.
     */
    public <T> T decode(Element element, Class<T> type) throws XmlDecodingException {
        return type.cast(decodeEntity(element, modelFor(type), element.tagName()));
    }

    private EntityModel modelFor(Class<?> type) {
        return models.computeIfAbsent(type, EntityModel::of);
    }

    /**
     * Decodes one record. A {@code null} element stands for an absent one, which yields
     * a record made only of defaults or fails on the first required field.
     */
    private Object decodeEntity(Element element, EntityModel model, String path) throws XmlDecodingException {
        Map<Element, ChildCursor> cursors = new IdentityHashMap<>();
        List<FieldBinding> fields = model.fields();
        Object[] arguments = new Object[fields.size()];
        for (int i = 0; i < arguments.length; i++) {
            arguments[i] = resolve(element, fields.get(i), model.searchMode(), cursors, path);
        }
        return model.instantiate(arguments, path);
    }

    private Object resolve(Element element, FieldBinding field, SearchMode mode,
                           Map<Element, ChildCursor> cursors, String path) throws XmlDecodingException {
        Element scope = element;
        String scopePath = path;
        for (String wrapper : field.wrappers()) {
            if (scope != null) {
                scope = cursor(scope, mode, cursors).enter(wrapper);
            }
            scopePath = scopePath + "/" + wrapper;
        }

        if (field.collection()) {
            if (scope == null) {
                return List.of();
            }
            List<Element> matches = cursor(scope, mode, cursors).takeAll(field.tag());
            List<Object> values = new ArrayList<>(matches.size());
            for (int i = 0; i < matches.size(); i++) {
                String itemPath = scopePath + "/" + field.tag() + "[" + (i + 1) + "]";
                values.add(convertElement(matches.get(i), field, itemPath));
            }
            return List.copyOf(values);
        }

        if (field.isAttribute()) {
            String attributePath = scopePath + "/@" + field.attribute();
            if (scope == null || !scope.hasAttr(field.attribute())) {
                return absent(field, attributePath);
            }
            return ScalarConverter.convert(scope.attr(field.attribute()), field.valueType(), attributePath);
        }

        if (field.isText()) {
            if (scope == null) {
                return absent(field, scopePath);
            }
            return ScalarConverter.convert(scope.text(), field.valueType(), scopePath);
        }

        String childPath = scopePath + "/" + field.tag();
        Element child = scope != null ? cursor(scope, mode, cursors).take(field.tag()) : null;
        if (child == null) {
            return absent(field, childPath);
        }
        return convertElement(child, field, childPath);
    }

    private Object convertElement(Element child, FieldBinding field, String path) throws XmlDecodingException {
        if (!field.variants().isEmpty()) {
            return decodeVariant(child, field.variants(), path);
        }
        if (field.valueType().isRecord()) {
            return decodeEntity(child, modelFor(field.valueType()), path);
        }
        return ScalarConverter.convert(child.text(), field.valueType(), path);
    }

    private Object decodeVariant(Element child, List<Class<?>> variants, String path) throws XmlDecodingException {
        XmlDecodingException lastFailure = null;
        for (Class<?> variant : variants) {
            try {
                return decodeEntity(child, modelFor(variant), path);
            } catch (XmlDecodingException e) {
                lastFailure = e;
            }
        }
        throw lastFailure;
    }

    private Object absent(FieldBinding field, String path) throws XmlDecodingException {
        if (field.defaultValue() != null) {
            return ScalarConverter.convert(field.defaultValue(), field.valueType(), path);
        }
        if (!field.optional()) {
            throw new XmlDecodingException("Missing required field " + field.describe(), path);
        }
        if (!field.variants().isEmpty()) {
            Class<?> fallback = field.variants().get(field.variants().size() - 1);
            return decodeEntity(null, modelFor(fallback), path);
        }
        return null;
    }

    private static ChildCursor cursor(Element element, SearchMode mode, Map<Element, ChildCursor> cursors) {
        return cursors.computeIfAbsent(element, e -> new ChildCursor(e.children(), mode));
    }
}
