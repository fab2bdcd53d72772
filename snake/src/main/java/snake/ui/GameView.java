package snake.ui;

import com.googlecode.lanterna.TerminalSize;
import com.googlecode.lanterna.TextColor;
import com.googlecode.lanterna.gui2.AbstractComponent;
import com.googlecode.lanterna.gui2.ComponentRenderer;
import com.googlecode.lanterna.gui2.TextGUIGraphics;
import snake.core.GameEngine;
import snake.core.Phase;
import snake.core.Pos;

public final class GameView extends AbstractComponent<GameView> {
    private static final TextColor BG = new TextColor.RGB(0, 0, 0);
    private static final TextColor BORDER = new TextColor.RGB(110, 110, 110);

    static final TextColor.RGB WHITE = new TextColor.RGB(255, 255, 255);
    static final TextColor.RGB RED = new TextColor.RGB(255, 50, 50);
    static final TextColor.RGB GREEN = new TextColor.RGB(50, 255, 50);
    static final TextColor.RGB GRAY = new TextColor.RGB(100, 100, 100);

    private final GameEngine game;
    private final boolean debugOutline;

    public GameView(GameEngine game, boolean debugOutline) {
        this.game = game;
        this.debugOutline = debugOutline;
    }

    @Override protected ComponentRenderer<GameView> createDefaultRenderer() {
        return new ComponentRenderer<>() {
            @Override public TerminalSize getPreferredSize(GameView c) {
                return new TerminalSize(fieldW(), fieldH());
            }

            @Override public void drawComponent(TextGUIGraphics g, GameView c) {
                g.setBackgroundColor(BG);
                g.setForegroundColor(BG);
                g.fill(' ');

                TextColor.RGB color = colorFor(game.phase());
                if (color == null) return;

                int fw = fieldW(), fh = fieldH();
                int aw = g.getSize().getColumns(), ah = g.getSize().getRows();
                int ox = Math.max(0, (aw - fw) / 2);
                int oy = Math.max(0, (ah - fh) / 2);

                g.setForegroundColor(BORDER);
                g.setBackgroundColor(BG);
                box(g, ox, oy, fw, fh);

                game.food().ifPresent(p -> food(g, ox, oy, p, color));

                TextColor.RGB outline = darker(color, 0.5);
                for (Pos p : game.body()) {
                    cell(g, ox, oy, p, color, debugOutline ? outline : null);
                }
                cell(g, ox, oy, game.head(), darker(color, 0.9), null);
            }
        };
    }

    /** Board colour for a phase, {@code null} when nothing is drawn. */
    static TextColor.RGB colorFor(Phase phase) {
        return switch (phase) {
            case RUNNING -> WHITE;
            case START, PAUSED -> GRAY;
            case LOSS -> RED;
            case WIN -> GREEN;
            case QUIT -> null;
        };
    }

    static TextColor.RGB darker(TextColor.RGB c, double k) {
        return new TextColor.RGB((int) (c.getRed() * k), (int) (c.getGreen() * k), (int) (c.getBlue() * k));
    }

    private int fieldW() { return game.cfg.w() * 2 + 2; }
    private int fieldH() { return game.cfg.h() + 2; }

    private static void box(TextGUIGraphics g, int x, int y, int w, int h) {
        int x2 = x + w - 1, y2 = y + h - 1;
        g.drawLine(x, y, x2, y, '─');
        g.drawLine(x, y2, x2, y2, '─');
        g.drawLine(x, y, x, y2, '│');
        g.drawLine(x2, y, x2, y2, '│');
        g.setCharacter(x, y, '┌');
        g.setCharacter(x2, y, '┐');
        g.setCharacter(x, y2, '└');
        g.setCharacter(x2, y2, '┘');
    }

    private static boolean fits(TextGUIGraphics g, int sx, int sy) {
        return sx >= 0 && sy >= 0 && sx + 1 < g.getSize().getColumns() && sy < g.getSize().getRows();
    }

    private static void cell(TextGUIGraphics g, int ox, int oy, Pos p, TextColor color, TextColor outline) {
        int sx = ox + 1 + p.x() * 2;
        int sy = oy + 1 + p.y();
        if (!fits(g, sx, sy)) return;
        g.setBackgroundColor(color);
        if (outline != null) {
            g.setForegroundColor(outline);
            g.putString(sx, sy, "[]");
        } else {
            g.setForegroundColor(color);
            g.putString(sx, sy, "  ");
        }
    }

    private static void food(TextGUIGraphics g, int ox, int oy, Pos p, TextColor color) {
        int sx = ox + 1 + p.x() * 2;
        int sy = oy + 1 + p.y();
        if (!fits(g, sx, sy)) return;
        g.setBackgroundColor(BG);
        g.setForegroundColor(color);
        g.putString(sx, sy, "()");
    }
}
