package quest.gekko.giveaway.dto;

import quest.gekko.giveaway.domain.OverlayPosition;

public record OverlayPositionDTO(String name, double x, double y) {
    public static OverlayPositionDTO of(OverlayPosition p) {
        return new OverlayPositionDTO(p.getName(), p.getX(), p.getY());
    }
}
