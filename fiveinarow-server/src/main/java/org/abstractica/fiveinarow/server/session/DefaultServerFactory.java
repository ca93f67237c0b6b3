package org.abstractica.fiveinarow.server.session;

import org.abstractica.fiveinarow.engine.Board;
import org.abstractica.fiveinarow.engine.Game;
import org.abstractica.fiveinarow.engine.GuardedGame;
import org.abstractica.fiveinarow.engine.WinDetector;
import org.abstractica.fiveinarow.protocol.serialization.GameProtocol;
import org.abstractica.fiveinarow.server.Server;
import org.abstractica.fiveinarow.server.ServerFactory;
import org.abstractica.fiveinarow.server.transport.FrameCodec;

import java.net.InetAddress;
import java.net.InetSocketAddress;

/**
 * Default implementation of ServerFactory.
 *
 * <p>Creates DefaultServer instances using a builder pattern.</p>
 */
public class DefaultServerFactory implements ServerFactory
{
    public static final int DEFAULT_PORT = 3333;

    @Override
    public Builder builder()
    {
        return new DefaultBuilder();
    }

    public static class DefaultBuilder implements Builder
    {
        private int port = DEFAULT_PORT;
        private InetAddress bindAddress;
        private int boardColumns = Board.DEFAULT_COLUMNS;
        private int boardRows = Board.DEFAULT_ROWS;
        private int runLength = WinDetector.DEFAULT_RUN_LENGTH;
        private int maxFrameSize = FrameCodec.DEFAULT_MAX_FRAME_SIZE;

        @Override
        public Builder port(int port)
        {
            if (port < 0 || port > 65535)
            {
                throw new IllegalArgumentException("Port must be 0-65535: " + port);
            }
            this.port = port;
            return this;
        }

        @Override
        public Builder bindAddress(InetAddress address)
        {
            this.bindAddress = address;
            return this;
        }

        @Override
        public Builder boardColumns(int columns)
        {
            if (columns <= 0)
            {
                throw new IllegalArgumentException("boardColumns must be positive: " + columns);
            }
            this.boardColumns = columns;
            return this;
        }

        @Override
        public Builder boardRows(int rows)
        {
            if (rows <= 0)
            {
                throw new IllegalArgumentException("boardRows must be positive: " + rows);
            }
            this.boardRows = rows;
            return this;
        }

        @Override
        public Builder runLength(int runLength)
        {
            if (runLength < 2)
            {
                throw new IllegalArgumentException("runLength must be at least 2: " + runLength);
            }
            this.runLength = runLength;
            return this;
        }

        @Override
        public Builder maxFrameSize(int size)
        {
            if (size <= 0)
            {
                throw new IllegalArgumentException("maxFrameSize must be positive: " + size);
            }
            this.maxFrameSize = size;
            return this;
        }

        @Override
        public Server build()
        {
            if (runLength > Math.max(boardColumns, boardRows))
            {
                throw new IllegalStateException("runLength " + runLength
                        + " does not fit on a " + boardColumns + "x" + boardRows + " board");
            }

            InetSocketAddress socketAddress;
            if (bindAddress != null)
            {
                socketAddress = new InetSocketAddress(bindAddress, port);
            }
            else
            {
                socketAddress = new InetSocketAddress(port);
            }

            Game game = new Game(new Board(boardColumns, boardRows), new WinDetector(runLength));

            return new DefaultServer(
                    socketAddress,
                    new GuardedGame(game),
                    new GameProtocol(),
                    maxFrameSize
            );
        }
    }
}
