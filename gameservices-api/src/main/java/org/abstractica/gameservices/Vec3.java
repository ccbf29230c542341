package org.abstractica.gameservices;

/**
 * A position in world space.
 *
 * @param x x coordinate
 * @param y y coordinate
 * @param z z coordinate
 */
public record Vec3(float x, float y, float z)
{
    public static final Vec3 ORIGIN = new Vec3(0f, 0f, 0f);

    /**
     * Returns the Euclidean distance to another position.
     *
     * @param other the other position
     * @return the distance
     */
    public double distanceTo(Vec3 other)
    {
        double dx = (double) x - other.x;
        double dy = (double) y - other.y;
        double dz = (double) z - other.z;
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }
}
