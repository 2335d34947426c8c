package org.carball.scholarflow.model.schema;

import java.util.List;
import java.util.Optional;

public record FormSchema(List<ApplicationField> fields, List<ApplicationDocument> documents) {

    public FormSchema {
        fields = List.copyOf(fields);
        documents = List.copyOf(documents);
    }

    public Optional<ApplicationField> field(String name) {
        return fields.stream().filter(f -> f.getName().equals(name)).findFirst();
    }

    public Optional<ApplicationDocument> document(String name) {
        return documents.stream().filter(d -> d.getName().equals(name)).findFirst();
    }
}
