package org.zhelev.avroconsumer.registry;

import org.zhelev.avroconsumer.SchemaResolutionException;

/**
 * Maps a schema registry id to the codec for that schema. Implementations may cache; resolving the same id twice
 * must yield codecs that behave identically.
 */
@FunctionalInterface
public interface SchemaResolver {

    SchemaCodec resolve(int schemaId) throws SchemaResolutionException;

}
