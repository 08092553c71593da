package com.glyphforge.model;

import com.glyphforge.api.model.BoundingBox;

import java.util.List;
import java.util.logging.Logger;

/**
 * Derives layout relationships between components of a {@link ComponentModel}.
 *
 * <ul>
 *   <li>{@code contains} / {@code contained_by} for every parent-child link</li>
 *   <li>{@code left_of} / {@code right_of} between a sibling and its nearest sibling to
 *       the right that shares at least one row</li>
 *   <li>{@code above} / {@code below} between a sibling and its nearest sibling below
 *       that shares at least one column</li>
 * </ul>
 */
public class SpatialRelationshipAnalyzer {
    private static final Logger logger = Logger.getLogger(SpatialRelationshipAnalyzer.class.getName());

    public static final String CONTAINS = "contains";
    public static final String CONTAINED_BY = "contained_by";
    public static final String LEFT_OF = "left_of";
    public static final String RIGHT_OF = "right_of";
    public static final String ABOVE = "above";
    public static final String BELOW = "below";

    /**
     * Adds the relationships to the model in place.
     *
     * @return number of relationships added
     */
    public int analyze(ComponentModel model) {
        int added = 0;
        for (AbstractComponent component : model.components()) {
            String parentId = component.getParentId();
            if (parentId != null) {
                added += model.relate(parentId, CONTAINS, component.getId()) ? 1 : 0;
                added += model.relate(component.getId(), CONTAINED_BY, parentId) ? 1 : 0;
            }
        }

        for (List<AbstractComponent> siblings : model.siblingGroups()) {
            for (AbstractComponent a : siblings) {
                AbstractComponent right = nearestRight(a, siblings);
                if (right != null) {
                    added += model.relate(a.getId(), LEFT_OF, right.getId()) ? 1 : 0;
                    added += model.relate(right.getId(), RIGHT_OF, a.getId()) ? 1 : 0;
                }
                AbstractComponent below = nearestBelow(a, siblings);
                if (below != null) {
                    added += model.relate(a.getId(), ABOVE, below.getId()) ? 1 : 0;
                    added += model.relate(below.getId(), BELOW, a.getId()) ? 1 : 0;
                }
            }
        }

        int total = added;
        logger.fine(() -> "Added " + total + " spatial relationships");
        return added;
    }

    private static AbstractComponent nearestRight(AbstractComponent a, List<AbstractComponent> siblings) {
        BoundingBox box = a.getBounds();
        AbstractComponent best = null;
        for (AbstractComponent b : siblings) {
            BoundingBox other = b.getBounds();
            if (b != a && other.xMin() > box.xMax() && box.overlapsVertically(other)
                && (best == null || other.xMin() < best.getBounds().xMin())) {
                best = b;
            }
        }
        return best;
    }

    private static AbstractComponent nearestBelow(AbstractComponent a, List<AbstractComponent> siblings) {
        BoundingBox box = a.getBounds();
        AbstractComponent best = null;
        for (AbstractComponent b : siblings) {
            BoundingBox other = b.getBounds();
            if (b != a && other.yMin() > box.yMax() && box.overlapsHorizontally(other)
                && (best == null || other.yMin() < best.getBounds().yMin())) {
                best = b;
            }
        }
        return best;
    }
}
