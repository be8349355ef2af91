package com.purchasingpower.sealstack.exception;

import lombok.Getter;

/**
 * No seal layer produced a selection, so there is nothing to assemble.
 * Carries the query that was asked, when known, and the entity it resolved to.
 */
@Getter
public class EmptyModuleException extends RuntimeException {

    private final String query;
    private final String entityName;

    public EmptyModuleException(String query, String entityName) {
        super(buildMessage(query, entityName));
        this.query = query;
        this.entityName = entityName;
    }

    private static String buildMessage(String query, String entityName) {
        StringBuilder message = new StringBuilder("No applicable patterns found on any seal layer");
        if (query != null && !query.isBlank()) {
            message.append(" for query '").append(query).append('\'');
        }
        if (entityName != null && !entityName.isBlank()) {
            message.append(" (entity '").append(entityName).append("')");
        }
        return message.toString();
    }

}
