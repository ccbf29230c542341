package org.abstractica.gameservices.world;

import org.abstractica.gameservices.Vec3;

import java.util.Objects;

/**
 * A spherical area query.
 *
 * @param center the query center
 * @param radius inclusive radius, non-negative
 * @param filter additional filter
 */
public record AreaQuery(Vec3 center, float radius, AreaFilter filter)
{
    public AreaQuery
    {
        Objects.requireNonNull(center, "center");
        Objects.requireNonNull(filter, "filter");
        if (Float.isNaN(radius) || radius < 0f)
        {
            throw new IllegalArgumentException("radius must be >= 0: " + radius);
        }
    }

    /**
     * Creates an unfiltered query.
     *
     * @param center the query center
     * @param radius inclusive radius
     * @return the query
     */
    public static AreaQuery all(Vec3 center, float radius)
    {
        return new AreaQuery(center, radius, new AreaFilter.All());
    }
}
