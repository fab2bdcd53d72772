package snake.app;

import com.googlecode.lanterna.TextColor;
import com.googlecode.lanterna.graphics.SimpleTheme;
import com.googlecode.lanterna.gui2.*;
import com.googlecode.lanterna.input.KeyStroke;
import com.googlecode.lanterna.screen.Screen;
import com.googlecode.lanterna.screen.TerminalScreen;
import com.googlecode.lanterna.terminal.DefaultTerminalFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import snake.core.GameEngine;
import snake.core.Phase;
import snake.ui.GameView;
import snake.ui.LanternaInput;

import java.util.List;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        SnakeSettings settings = SnakeSettings.load();
        GameEngine game = new GameEngine(settings.gameConfig());
        log.info("starting {}x{} game, frame delay {}", settings.width(), settings.height(), settings.frameDelay());

        Screen screen = new TerminalScreen(new DefaultTerminalFactory().createTerminal());
        screen.startScreen();
        screen.setCursorPosition(null);

        try {
            MultiWindowTextGUI gui = new MultiWindowTextGUI(
                    screen, new DefaultWindowManager(), new EmptySpace()
            );
            gui.setTheme(new SimpleTheme(
                    TextColor.ANSI.WHITE,
                    TextColor.ANSI.BLACK
            ));

            BasicWindow w = new BasicWindow("Snake");
            w.setHints(List.of(Window.Hint.FULL_SCREEN));

            Panel root = new Panel(new BorderLayout());

            Label help = new Label("Arrows/WASD: turn   Space: start/pause   Esc: reset   Q: quit");
            root.addComponent(help.withBorder(Borders.singleLine()), BorderLayout.Location.TOP);

            GameView view = new GameView(game, settings.debugOutline());
            root.addComponent(view.withBorder(Borders.singleLine("Field")), BorderLayout.Location.CENTER);

            Label status = new Label("");
            root.addComponent(status.withBorder(Borders.singleLine("Status")), BorderLayout.Location.BOTTOM);

            w.setComponent(root);
            gui.addWindow(w);

            run(gui, screen, game, view, status, settings);
        } finally {
            screen.stopScreen();
            log.info("terminal released");
        }
    }

    private static void run(MultiWindowTextGUI gui, Screen screen, GameEngine game, GameView view,
                            Label status, SnakeSettings settings) throws Exception {
        LanternaInput input = new LanternaInput();
        long frameDelayMs = settings.frameDelay().toMillis();
        long startNs = System.nanoTime();

        while (game.phase() != Phase.QUIT) {
            long now = (System.nanoTime() - startNs) / 1_000_000;

            for (KeyStroke k; (k = screen.pollInput()) != null; ) {
                var in = input.map(k);
                switch (in.action()) {
                    case QUIT -> game.onQuit();
                    case RESET -> game.onReset();
                    case PAUSE_TOGGLE -> game.onTogglePause(now);
                    case NONE -> {
                        if (in.dir() != null) game.tryChangeDirection(in.dir());
                    }
                }
            }

            game.onUpdate(now);

            status.setText(game.phase() + "   speed=" + game.speed() + "   length=" + game.body().size());
            view.invalidate();
            gui.updateScreen();

            try {
                Thread.sleep(frameDelayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("interrupted, quitting");
                game.onQuit();
            }
        }
        log.info("game quit");
    }
}
