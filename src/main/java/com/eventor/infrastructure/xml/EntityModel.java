package com.eventor.infrastructure.xml;

import com.eventor.domain.mapping.Attribute;
import com.eventor.domain.mapping.DefaultValue;
import com.eventor.domain.mapping.Element;
import com.eventor.domain.mapping.OneOf;
import com.eventor.domain.mapping.SearchMode;
import com.eventor.domain.mapping.Text;
import com.eventor.domain.mapping.Wrapped;
import com.eventor.domain.mapping.XmlEntity;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Mapping table of one record type, built once from its annotations.
 */
final class EntityModel {

    private final Class<?> type;
    private final String tag;
    private final SearchMode searchMode;
    private final List<FieldBinding> fields;
    private final Constructor<?> constructor;

    private EntityModel(Class<?> type, String tag, SearchMode searchMode,
                        List<FieldBinding> fields, Constructor<?> constructor) {
        this.type = type;
        this.tag = tag;
        this.searchMode = searchMode;
        this.fields = fields;
        this.constructor = constructor;
    }

    static EntityModel of(Class<?> type) {
        if (!type.isRecord()) {
            throw new IllegalStateException(type.getName() + " is not a record");
        }
        XmlEntity entity = type.getAnnotation(XmlEntity.class);
        String tag = entity != null && !entity.tag().isEmpty() ? entity.tag() : null;
        SearchMode searchMode = entity != null ? entity.searchMode() : SearchMode.UNORDERED;

        RecordComponent[] components = type.getRecordComponents();
        List<FieldBinding> fields = new ArrayList<>(components.length);
        Class<?>[] parameterTypes = new Class<?>[components.length];
        for (int i = 0; i < components.length; i++) {
            fields.add(bind(type, components[i]));
            parameterTypes[i] = components[i].getType();
        }

        try {
            Constructor<?> constructor = type.getDeclaredConstructor(parameterTypes);
            constructor.setAccessible(true);
            return new EntityModel(type, tag, searchMode, List.copyOf(fields), constructor);
        } catch (NoSuchMethodException e) {
            throw new IllegalStateException("No canonical constructor on " + type.getName(), e);
        }
    }

    private static FieldBinding bind(Class<?> owner, RecordComponent component) {
        String where = owner.getSimpleName() + "." + component.getName();

        List<String> wrappers = List.of();
        String tag = null;
        String attribute = null;
        boolean optional;
        int locations = 0;

        Element element = component.getAnnotation(Element.class);
        Attribute attr = component.getAnnotation(Attribute.class);
        Wrapped wrapped = component.getAnnotation(Wrapped.class);
        Text text = component.getAnnotation(Text.class);

        if (element != null) {
            locations++;
            tag = element.value();
            optional = element.optional();
        } else if (attr != null) {
            optional = attr.optional();
        } else if (wrapped != null) {
            optional = wrapped.optional();
        } else if (text != null) {
            optional = text.optional();
        } else {
            throw new IllegalStateException("No XML location declared for " + where);
        }
        if (attr != null) {
            locations++;
            attribute = attr.value();
        }
        if (wrapped != null) {
            locations++;
            List<String> segments = Arrays.asList(wrapped.value().split("/"));
            if (wrapped.attribute().isEmpty()) {
                wrappers = List.copyOf(segments.subList(0, segments.size() - 1));
                tag = segments.get(segments.size() - 1);
            } else {
                wrappers = List.copyOf(segments);
                attribute = wrapped.attribute();
            }
        }
        if (text != null) {
            locations++;
        }
        if (locations > 1) {
            throw new IllegalStateException("More than one XML location declared for " + where);
        }

        boolean collection = component.getType() == List.class;
        Class<?> valueType = collection ? listElementType(component, where) : component.getType();

        DefaultValue defaultValue = component.getAnnotation(DefaultValue.class);
        OneOf oneOf = component.getAnnotation(OneOf.class);
        List<Class<?>> variants = oneOf != null ? List.<Class<?>>of(oneOf.value()) : List.of();

        if (collection && tag == null) {
            throw new IllegalStateException("Collection " + where + " must read child elements");
        }
        if (!variants.isEmpty()) {
            for (Class<?> variant : variants) {
                if (!valueType.isAssignableFrom(variant)) {
                    throw new IllegalStateException(variant.getName() + " is not a " + valueType.getName()
                        + " in " + where);
                }
            }
        } else if (!valueType.isRecord() && !ScalarConverter.supports(valueType)) {
            throw new IllegalStateException("Unsupported type " + valueType.getName() + " for " + where);
        }
        if (valueType.isRecord() && tag == null) {
            throw new IllegalStateException("Record field " + where + " must read a child element");
        }
        if (optional && defaultValue == null && !collection && valueType.isPrimitive()) {
            throw new IllegalStateException("Optional field " + where + " needs a boxed type");
        }

        return new FieldBinding(
            component.getName(),
            wrappers,
            tag,
            attribute,
            valueType,
            collection,
            optional || defaultValue != null || collection,
            defaultValue != null ? defaultValue.value() : null,
            variants
        );
    }

    private static Class<?> listElementType(RecordComponent component, String where) {
        Type generic = component.getGenericType();
        if (generic instanceof ParameterizedType parameterized
            && parameterized.getActualTypeArguments()[0] instanceof Class<?> elementType) {
            return elementType;
        }
        throw new IllegalStateException("Cannot resolve the element type of " + where);
    }

    Object instantiate(Object[] arguments, String path) throws XmlDecodingException {
        try {
            return constructor.newInstance(arguments);
        } catch (InvocationTargetException e) {
            throw new XmlDecodingException(
                type.getSimpleName() + " rejected decoded values: " + e.getCause().getMessage(),
                path, e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot instantiate " + type.getName(), e);
        }
    }

    /** Root tag, or {@code null} for anonymous fragments. */
    String tag() {
        return tag;
    }

    SearchMode searchMode() {
        return searchMode;
    }

    List<FieldBinding> fields() {
        return fields;
    }
}
