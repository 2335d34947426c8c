package org.carball.scholarflow.model.schema;

public record MissingItem(Kind kind, String name) {

    public enum Kind {
        FIELD,
        DOCUMENT,
        SUB_SCHOLARSHIP
    }

    public static MissingItem field(String name) {
        return new MissingItem(Kind.FIELD, name);
    }

    public static MissingItem document(String name) {
        return new MissingItem(Kind.DOCUMENT, name);
    }

    public static MissingItem subScholarship() {
        return new MissingItem(Kind.SUB_SCHOLARSHIP, "sub_scholarship");
    }

    public String describe() {
        return kind.name().toLowerCase() + " '" + name + "'";
    }
}
