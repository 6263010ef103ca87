package de.bsommerfeld.dbqueue.core.row;

/**
 * Maps a whole {@link Row} to an application object.
 *
 * <p>
 * Mappers compose: a projection that adds computed columns to an entity can
 * map the entity with the entity's own mapper and read the extra columns from
 * the same row, without subclassing the entity.
 *
 * @param <T> the produced type
 */
@FunctionalInterface
public interface RowMapper<T> {

    T map(Row row);
}
