package org.tesis.depot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * División de rectángulos libres alrededor de un área recién colocada.
 *
 * La firma de 4 bits compara los bordes del libre (av) con los del área:
 * <pre>
 *   bit 3: av.left   >= item.left
 *   bit 2: av.bottom >= item.bottom
 *   bit 1: av.right  >  item.right
 *   bit 0: av.top    >  item.top
 * </pre>
 * y es el índice de la tabla de piezas a generar.
 */
final class FreeSpace {

    // firma de un libre totalmente cubierto por el área (se descarta antes de consultar la tabla)
    static final int COVERED = 0b1100;
    // firma de un área estrictamente dentro del libre
    static final int ITEM_INSIDE = 0b0011;

    // piezas posibles de un libre partido
    enum Piece {
        BELOW {  // (av.left, av.bottom) -> (av.right, item.bottom)
            Rectangle cut(Rectangle av, Rectangle item) {
                return new Rectangle(av.xRight().subtract(av.xLeft()), item.yBottom().subtract(av.yBottom()),
                        av.xLeft(), av.yBottom());
            }
        },
        ABOVE {  // (av.left, item.top) -> (av.right, av.top)
            Rectangle cut(Rectangle av, Rectangle item) {
                return new Rectangle(av.xRight().subtract(av.xLeft()), av.yTop().subtract(item.yTop()),
                        av.xLeft(), item.yTop());
            }
        },
        LEFT {   // (av.left, av.bottom) -> (item.left, av.top)
            Rectangle cut(Rectangle av, Rectangle item) {
                return new Rectangle(item.xLeft().subtract(av.xLeft()), av.yTop().subtract(av.yBottom()),
                        av.xLeft(), av.yBottom());
            }
        },
        RIGHT {  // (item.right, av.bottom) -> (av.right, av.top)
            Rectangle cut(Rectangle av, Rectangle item) {
                return new Rectangle(av.xRight().subtract(item.xRight()), av.yTop().subtract(av.yBottom()),
                        item.xRight(), av.yBottom());
            }
        };

        abstract Rectangle cut(Rectangle av, Rectangle item);
    }

    static final Piece[] ALL_SIDES = { Piece.BELOW, Piece.ABOVE, Piece.LEFT, Piece.RIGHT };

    // null = firma inalcanzable
    private static final Piece[][] SPLIT_TABLE = {
            /* 0000 */ { Piece.BELOW, Piece.LEFT },
            /* 0001 */ { Piece.BELOW, Piece.ABOVE, Piece.LEFT },
            /* 0010 */ { Piece.BELOW, Piece.LEFT, Piece.RIGHT },
            /* 0011 */ null,
            /* 0100 */ { Piece.LEFT },
            /* 0101 */ { Piece.ABOVE, Piece.LEFT },
            /* 0110 */ { Piece.LEFT, Piece.RIGHT },
            /* 0111 */ { Piece.ABOVE, Piece.LEFT, Piece.RIGHT },
            /* 1000 */ { Piece.BELOW },
            /* 1001 */ { Piece.BELOW, Piece.ABOVE },
            /* 1010 */ { Piece.BELOW, Piece.RIGHT },
            /* 1011 */ { Piece.BELOW, Piece.ABOVE, Piece.RIGHT },
            /* 1100 */ null,
            /* 1101 */ { Piece.ABOVE },
            /* 1110 */ { Piece.RIGHT },
            /* 1111 */ { Piece.ABOVE, Piece.RIGHT },
    };

    private FreeSpace() {}

    static int signature(Rectangle av, Rectangle item) {
        int code = 0;
        if (av.xLeft().compareTo(item.xLeft()) >= 0)     code |= 0b1000;
        if (av.yBottom().compareTo(item.yBottom()) >= 0) code |= 0b0100;
        if (av.xRight().compareTo(item.xRight()) > 0)    code |= 0b0010;
        if (av.yTop().compareTo(item.yTop()) > 0)        code |= 0b0001;
        return code;
    }

    // piezas de la tabla base; null si la firma es inalcanzable
    static Piece[] tableEntry(int code) {
        return SPLIT_TABLE[code];
    }

    static String bits(int code) {
        String s = Integer.toBinaryString(code);
        return "0000".substring(s.length()) + s;
    }

    // elimina los libres encerrados por otro; se recorren pares por área descendente
    static void pruneEnclosed(List<Rectangle> availables) {
        List<Rectangle> pool = new ArrayList<>(availables);
        pool.sort(Comparator.comparing(Rectangle::area).reversed());
        Set<Rectangle> removals = Collections.newSetFromMap(new IdentityHashMap<>());
        for (int i = 0; i < pool.size(); i++) {
            for (int j = i + 1; j < pool.size(); j++) {
                if (RectUtils.contains(pool.get(i), pool.get(j))) {
                    removals.add(pool.get(j));
                }
            }
        }
        availables.removeIf(removals::contains);
    }
}
