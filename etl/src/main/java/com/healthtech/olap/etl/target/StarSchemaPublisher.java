package com.healthtech.olap.etl.target;

import com.healthtech.olap.data.star.StarSchema;

/**
 * Replaces the content of the target star schema with a staged load.
 */
public interface StarSchemaPublisher {

    PublishResult publish(StarSchema schema);
}
