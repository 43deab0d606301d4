package ai.uno.player;

import ai.uno.game.Card;
import ai.uno.game.Color;
import ai.uno.game.Hand;
import ai.uno.game.Move;
import ai.uno.game.TableView;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Scanner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Human player that reads choices from stdin (CLI).
 * <p>
 * Shows the top card, active colour, pending draw and the numbered hand, then asks for a card
 * number or 0 to draw. Out-of-range input is re-prompted here; a card that does not match, or
 * a non-stacking card under a pending draw, is reported back to the engine as
 * {@link Move#invalid()} and costs a penalty card.
 */
@Component
@Profile("uno-human")
public class HumanPlayer implements Player {
    private final Scanner scanner;
    private final PrintStream out;

    public HumanPlayer() {
        this(System.in, System.out);
    }

    public HumanPlayer(InputStream in, PrintStream out) {
        this.scanner = new Scanner(in);
        this.out = out;
    }

    /**
     * @throws NoSuchElementException if the console input is closed
     */
    @Override
    public Move chooseMove(TableView table, Hand hand) {
        Card top = table.getTopDiscard();
        out.println();
        out.println("Your turn - Top: [" + top.toColoredString() + "] Active color: " + table.getActiveColor());
        out.println("Draw pile: " + table.getDrawPileSize() + " | Cards per seat: " + table.getHandSizes());
        out.println("Your hand:");
        List<Card> cards = hand.getCards();
        for (int i = 0; i < cards.size(); i++) {
            out.printf("  %2d) %s%n", i + 1, cards.get(i).toColoredString());
        }
        if (table.getPendingDraw() > 0) {
            out.println("Pending draw to you: " + table.getPendingDraw()
                    + " (stackable with DRAW_TWO or WILD_DRAW_FOUR)");
        }
        int choice = readInt("Choose a card number to play, or 0 to draw: ", 0, cards.size());
        if (choice == 0) {
            return Move.draw();
        }
        Card chosen = cards.get(choice - 1);
        if (!chosen.matches(top, table.getActiveColor())) {
            out.println("Illegal play. You must match color/rank or play a wild.");
            return Move.invalid();
        }
        if (table.getPendingDraw() > 0 && !chosen.getRank().isDrawPenalty()) {
            out.println("You must stack with DRAW_TWO or WILD_DRAW_FOUR, or draw.");
            return Move.invalid();
        }
        Color color = chosen.isWild() ? askColor() : null;
        return Move.play(chosen, color, false);
    }

    private Color askColor() {
        out.println("Choose color: 1) RED  2) YELLOW  3) GREEN  4) BLUE");
        return Color.STANDARD.get(readInt("> ", 1, Color.STANDARD.size()) - 1);
    }

    private int readInt(String prompt, int min, int max) {
        while (true) {
            out.print(prompt);
            if (!scanner.hasNextLine()) {
                throw new NoSuchElementException("Console input closed");
            }
            String line = scanner.nextLine().trim();
            if (line.matches("\\d{1,4}")) {
                int value = Integer.parseInt(line);
                if (value >= min && value <= max) {
                    return value;
                }
            }
            out.println("Enter a number between " + min + " and " + max + ".");
        }
    }
}
