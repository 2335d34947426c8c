package org.carball.scholarflow.catalog;

/**
 * Answers whether reference data is already referenced by applications. Implemented by the
 * application store; consulted before structural changes to scholarship types and schemas.
 */
public interface UsageProbe {

    boolean hasApplications(String scholarshipTypeCode);

    boolean isFieldInUse(String scholarshipTypeCode, String fieldName);

    boolean isDocumentInUse(String scholarshipTypeCode, String documentName);

    static UsageProbe none() {
        return new UsageProbe() {
            @Override
            public boolean hasApplications(String scholarshipTypeCode) {
                return false;
            }

            @Override
            public boolean isFieldInUse(String scholarshipTypeCode, String fieldName) {
                return false;
            }

            @Override
            public boolean isDocumentInUse(String scholarshipTypeCode, String documentName) {
                return false;
            }
        };
    }
}
