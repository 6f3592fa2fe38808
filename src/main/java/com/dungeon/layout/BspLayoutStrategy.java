package com.dungeon.layout;

import com.dungeon.model.Position;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Binary space partition of a square area into rooms; each leaf room becomes a
 * node placed at the room's center.
 */
@Component
@Slf4j
public class BspLayoutStrategy implements LayoutStrategy {

    private record Room(int x, int y, int width, int height) {

        Position center() {
            return Position.of(x + width / 2, y + height / 2);
        }
    }

    @Override
    public LayoutType type() {
        return LayoutType.BSP;
    }

    @Override
    public List<LayoutNode> layout(String regionId, GraphLayout layout, Random random) {
        GraphLayout.Bsp bsp = (GraphLayout.Bsp) layout;
        List<Room> leaves = new ArrayList<>();
        split(new Room(0, 0, GraphLayout.Bsp.AREA_SIZE, GraphLayout.Bsp.AREA_SIZE), 0, bsp, random, leaves);

        List<LayoutNode> nodes = new ArrayList<>(leaves.size());
        for (int i = 0; i < leaves.size(); i++) {
            nodes.add(new LayoutNode(regionId + ":bsp_" + i, leaves.get(i).center()));
        }
        log.debug("BSP partition produced {} rooms for region {}", nodes.size(), regionId);
        return nodes;
    }

    private void split(Room room, int depth, GraphLayout.Bsp bsp, Random random, List<Room> leaves) {
        int min = bsp.minRoomSize();
        if (depth >= bsp.maxDepth() || room.width() < 2 * min || room.height() < 2 * min) {
            leaves.add(room);
            return;
        }

        boolean vertical;
        if (room.width() != room.height()) {
            vertical = room.width() > room.height();
        } else {
            vertical = random.nextBoolean();
        }

        if (vertical) {
            int offset = min + random.nextInt(room.width() - 2 * min + 1);
            split(new Room(room.x(), room.y(), offset, room.height()), depth + 1, bsp, random, leaves);
            split(new Room(room.x() + offset, room.y(), room.width() - offset, room.height()), depth + 1, bsp, random, leaves);
        } else {
            int offset = min + random.nextInt(room.height() - 2 * min + 1);
            split(new Room(room.x(), room.y(), room.width(), offset), depth + 1, bsp, random, leaves);
            split(new Room(room.x(), room.y() + offset, room.width(), room.height() - offset), depth + 1, bsp, random, leaves);
        }
    }
}
