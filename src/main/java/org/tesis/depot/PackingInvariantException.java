package org.tesis.depot;

/**
 * Defecto interno del empaquetador (estado que no debería poder alcanzarse).
 * No es infactibilidad: quien lo recibe debe abortar la evaluación.
 */
public class PackingInvariantException extends RuntimeException {

    public PackingInvariantException(String message) {
        super(message);
    }
}
