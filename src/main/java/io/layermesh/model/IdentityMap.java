package io.layermesh.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Lets repeated references to the same logical object converge to one instance while
 * deserializing. The storage behind it is up to the application.
 */
public interface IdentityMap {
    IdentityMap NONE = new IdentityMap() {
        @Override
        public ModelInstance getInstance(ModelClass type, ObjectNode object, ModelInstance previousInstance) {
            return null;
        }

        @Override
        public void setInstance(ModelClass type, ModelInstance instance) {
        }
    };

    /**
     * @return the instance already standing for {@code object}, or {@code null} to build a new one
     */
    ModelInstance getInstance(ModelClass type, ObjectNode object, ModelInstance previousInstance);

    void setInstance(ModelClass type, ModelInstance instance);
}
