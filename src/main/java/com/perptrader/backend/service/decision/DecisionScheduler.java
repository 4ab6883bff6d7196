package com.perptrader.backend.service.decision;

import com.perptrader.backend.model.Decision;
import com.perptrader.backend.model.TradeAction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders decisions so closes free margin before opens run. Equal priorities keep their input order.
 */
@Component
public class DecisionScheduler {

    public List<Decision> sort(List<Decision> decisions) {
        List<Decision> sorted = new ArrayList<>(decisions);
        // List.sort is stable
        sorted.sort(Comparator.comparingInt(d -> TradeAction.priorityOf(d.getAction())));
        return sorted;
    }
}
