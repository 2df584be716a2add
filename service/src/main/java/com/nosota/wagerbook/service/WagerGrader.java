package com.nosota.wagerbook.service;

import com.nosota.wagerbook.api.model.Selection;
import com.nosota.wagerbook.api.model.WagerStatus;
import com.nosota.wagerbook.model.Event;
import com.nosota.wagerbook.model.Line;
import com.nosota.wagerbook.model.Market;
import com.nosota.wagerbook.model.Wager;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Decides the outcome of a wager from its event's final score.
 *
 * <ul>
 *   <li>MONEYLINE: the selected side scoring more wins, a tie pushes</li>
 *   <li>SPREAD: selected score plus the accepted point against the opponent's score</li>
 *   <li>TOTAL: combined score against the accepted point, OVER wins above and UNDER below</li>
 * </ul>
 * A SPREAD or TOTAL wager accepted without a point is graded VOID.
 * Grading always uses the wager's accepted point, never a later line.
 */
@Component
public class WagerGrader {

    public WagerStatus grade(Wager wager, Line line, Market market, Event event) {
        Selection selection = line.getSelection();
        if (!event.hasFinalScore()) {
            throw new IllegalStateException("Event has no final score: eventId=" + event.getId());
        }
        int home = event.getHomeScore();
        int away = event.getAwayScore();

        switch (market.getType()) {
            case MONEYLINE -> {
                return compare(selectedScore(selection, home, away), opponentScore(selection, home, away));
            }
            case SPREAD -> {
                return gradeSpread(wager.getAcceptedPoint(), selection, home, away);
            }
            case TOTAL -> {
                return gradeTotal(wager.getAcceptedPoint(), selection, home, away);
            }
            default -> throw new IllegalStateException("Unsupported market type: " + market.getType());
        }
    }

    private static WagerStatus gradeSpread(BigDecimal point, Selection selection, int home, int away) {
        if (point == null) {
            return WagerStatus.VOID;
        }
        BigDecimal adjusted = BigDecimal.valueOf(selectedScore(selection, home, away)).add(point);
        return compare(adjusted, BigDecimal.valueOf(opponentScore(selection, home, away)));
    }

    private static WagerStatus gradeTotal(BigDecimal point, Selection selection, int home, int away) {
        if (point == null) {
            return WagerStatus.VOID;
        }
        int cmp = BigDecimal.valueOf(home + away).compareTo(point);
        if (cmp == 0) {
            return WagerStatus.PUSH;
        }
        boolean over = cmp > 0;
        return (selection == Selection.OVER) == over ? WagerStatus.WON : WagerStatus.LOST;
    }

    private static int selectedScore(Selection selection, int home, int away) {
        return selection == Selection.HOME ? home : away;
    }

    private static int opponentScore(Selection selection, int home, int away) {
        return selection == Selection.HOME ? away : home;
    }

    private static WagerStatus compare(int selected, int opponent) {
        return compare(BigDecimal.valueOf(selected), BigDecimal.valueOf(opponent));
    }

    private static WagerStatus compare(BigDecimal selected, BigDecimal opponent) {
        int cmp = selected.compareTo(opponent);
        if (cmp > 0) {
            return WagerStatus.WON;
        }
        return cmp < 0 ? WagerStatus.LOST : WagerStatus.PUSH;
    }
}
