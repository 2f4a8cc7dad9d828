package org.angle;

/**
 * Strategy interface for one angle unit.
 * Implementations own a single representation of {@link Angle}: they know how to
 * derive it from the other representations and how to fold it into its principal range.
 */
public interface AngleConversion {

    /**
     * @return the unit whose representation this conversion owns.
     */
    AngleUnit unit();

    /**
     * Returns an angle carrying this unit's representation.
     * If the representation is already present the same instance is returned;
     * otherwise a new angle is returned with the representation added.
     *
     * @throws IllegalStateException if the angle carries no representation to convert from
     */
    Angle ensure(Angle angle);

    /**
     * Folds the angle into this unit's principal range, discarding complete
     * revolutions and converting negatives.
     */
    Angle abs(Angle angle);
}
