package org.abstractica.fiveinarow.engine;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * A registered participant, owned by the game roster.
 *
 * <p>The color stays unset until the first move of a game assigns it and
 * is only reassigned by the next opening move.</p>
 */
public final class Player
{
    private final String peer;
    private final String name;
    private int color;

    Player(String peer, String name)
    {
        this.peer = Objects.requireNonNull(peer, "peer");
        this.name = Objects.requireNonNull(name, "name");
        this.color = Board.EMPTY;
    }

    public String getPeer()
    {
        return peer;
    }

    public String getName()
    {
        return name;
    }

    public OptionalInt getColor()
    {
        return color == Board.EMPTY ? OptionalInt.empty() : OptionalInt.of(color);
    }

    void setColor(int color)
    {
        this.color = color;
    }

    @Override
    public String toString()
    {
        return name + "@" + peer;
    }
}
