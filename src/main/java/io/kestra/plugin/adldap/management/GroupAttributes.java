package io.kestra.plugin.adldap.management;

import io.kestra.plugin.adldap.exceptions.InvalidAttributeException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Attributes of a group to create.
 */
@Value
@Builder
public class GroupAttributes {
    String groupName;

    String description;

    /** Organizational units holding the group, outermost first. */
    @Singular
    List<String> containers;

    void validateRequired() throws InvalidAttributeException {
        if (groupName == null || groupName.isBlank()) {
            throw new InvalidAttributeException("Missing compulsory field [groupName]");
        }
        if (containers == null || containers.isEmpty()) {
            throw new InvalidAttributeException("Missing compulsory field [containers]");
        }
        for (String container : containers) {
            if (container == null || container.isBlank()) {
                throw new InvalidAttributeException("Containers can't hold a blank organizational unit");
            }
        }
    }
}
