package com.stage.composition.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A node of the scene tree.
 * Prims exist only inside one parse, merge or resolve result; every re-parse produces new instances.
 */
public class Prim {
    private final String path;
    private final String name;
    private Specifier specifier;
    private String type;
    private final LinkedHashMap<String, Property> properties;
    private final List<Prim> children;
    private AssetReference reference;
    private AssetReference payload;
    private TextSpan span;
    private Provenance provenance;

    private Prim(Builder builder) {
        this.path = builder.path;
        this.name = builder.name != null ? builder.name : lastSegment(builder.path);
        this.specifier = builder.specifier != null ? builder.specifier : Specifier.DEFINE;
        this.type = builder.type;
        this.properties = new LinkedHashMap<>(builder.properties);
        this.children = new ArrayList<>(builder.children);
        this.reference = builder.reference;
        this.payload = builder.payload;
        this.span = builder.span;
        this.provenance = builder.provenance;
    }

    public String getPath() {
        return path;
    }

    public String getName() {
        return name;
    }

    public Specifier getSpecifier() {
        return specifier;
    }

    public void setSpecifier(Specifier specifier) {
        this.specifier = Objects.requireNonNull(specifier, "specifier is required");
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    /**
     * Live, ordered property map keyed by property name.
     */
    public Map<String, Property> getProperties() {
        return properties;
    }

    public Optional<Property> getProperty(String key) {
        return Optional.ofNullable(properties.get(key));
    }

    /**
     * Plain textual value of a property, if declared.
     */
    public Optional<String> getPropertyText(String key) {
        return getProperty(key).map(Property::asText);
    }

    public void putProperty(String key, Property property) {
        properties.put(key, property);
    }

    /**
     * Live, ordered child list.
     */
    public List<Prim> getChildren() {
        return children;
    }

    public void addChild(Prim child) {
        children.add(child);
    }

    public AssetReference getReference() {
        return reference;
    }

    public void setReference(AssetReference reference) {
        this.reference = reference;
    }

    public AssetReference getPayload() {
        return payload;
    }

    public void setPayload(AssetReference payload) {
        this.payload = payload;
    }

    /**
     * The composition arc this prim declares: its reference, else its payload.
     */
    public Optional<AssetReference> getAssetReference() {
        return Optional.ofNullable(reference != null ? reference : payload);
    }

    public boolean hasAssetReference() {
        return reference != null || payload != null;
    }

    public Optional<TextSpan> getSpan() {
        return Optional.ofNullable(span);
    }

    public void setSpan(TextSpan span) {
        this.span = span;
    }

    public Optional<Provenance> getProvenance() {
        return Optional.ofNullable(provenance);
    }

    public void setProvenance(Provenance provenance) {
        this.provenance = provenance;
    }

    /**
     * Copies this prim and its whole subtree. Property maps and child lists are
     * independent of the original; property values and spans are immutable and shared.
     */
    public Prim deepCopy() {
        return rebase(path);
    }

    /**
     * Copies this prim and its subtree under a new path, rewriting every descendant path.
     */
    public Prim rebase(String newPath) {
        Prim copy = builder(this)
                .path(newPath)
                .name(lastSegment(newPath))
                .children(List.of())
                .build();
        for (Prim child : children) {
            copy.children.add(child.rebase(newPath + "/" + child.name));
        }
        return copy;
    }

    /**
     * Copies this prim alone: properties are copied, children are not.
     */
    public Prim shallowCopy() {
        return builder(this).children(List.of()).build();
    }

    public String getParentPath() {
        int idx = path.lastIndexOf('/');
        return idx <= 0 ? null : path.substring(0, idx);
    }

    public boolean isRoot() {
        return getParentPath() == null;
    }

    static String lastSegment(String path) {
        int idx = path.lastIndexOf('/');
        return idx >= 0 ? path.substring(idx + 1) : path;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Prim prim = (Prim) o;
        return Objects.equals(path, prim.path)
                && specifier == prim.specifier
                && Objects.equals(type, prim.type)
                && Objects.equals(properties, prim.properties)
                && Objects.equals(children, prim.children)
                && Objects.equals(reference, prim.reference)
                && Objects.equals(payload, prim.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, specifier, type);
    }

    @Override
    public String toString() {
        return "Prim{" +
                "path='" + path + '\'' +
                ", specifier=" + specifier +
                ", type='" + type + '\'' +
                ", properties=" + properties.keySet() +
                ", children=" + children.size() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Prim prim) {
        return new Builder()
                .path(prim.path)
                .name(prim.name)
                .specifier(prim.specifier)
                .type(prim.type)
                .properties(prim.properties)
                .children(prim.children)
                .reference(prim.reference)
                .payload(prim.payload)
                .span(prim.span)
                .provenance(prim.provenance);
    }

    public static class Builder {
        private String path;
        private String name;
        private Specifier specifier;
        private String type;
        private Map<String, Property> properties = Collections.emptyMap();
        private List<Prim> children = Collections.emptyList();
        private AssetReference reference;
        private AssetReference payload;
        private TextSpan span;
        private Provenance provenance;

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder specifier(Specifier specifier) {
            this.specifier = specifier;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder properties(Map<String, Property> properties) {
            this.properties = properties != null ? properties : Collections.emptyMap();
            return this;
        }

        public Builder property(String key, Property property) {
            Map<String, Property> copy = new LinkedHashMap<>(this.properties);
            copy.put(key, property);
            this.properties = copy;
            return this;
        }

        public Builder children(List<Prim> children) {
            this.children = children != null ? children : Collections.emptyList();
            return this;
        }

        public Builder child(Prim child) {
            List<Prim> copy = new ArrayList<>(this.children);
            copy.add(child);
            this.children = copy;
            return this;
        }

        public Builder reference(AssetReference reference) {
            this.reference = reference;
            return this;
        }

        public Builder payload(AssetReference payload) {
            this.payload = payload;
            return this;
        }

        public Builder span(TextSpan span) {
            this.span = span;
            return this;
        }

        public Builder provenance(Provenance provenance) {
            this.provenance = provenance;
            return this;
        }

        public Prim build() {
            Objects.requireNonNull(path, "path is required");
            if (!path.startsWith("/")) {
                throw new IllegalArgumentException("path must be absolute: " + path);
            }
            return new Prim(this);
        }
    }
}
