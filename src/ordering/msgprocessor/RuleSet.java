/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package ordering.msgprocessor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import ordering.util.OrdererCommon.OrdererException;
import org.hyperledger.fabric.protos.common.Common;

/**
 * Applies a list of rules in order. The first rule to reject an envelope
 * decides the outcome; later rules are not consulted.
 *
 * @author joao
 */
public class RuleSet implements Rule {

    private final List<Rule> rules;

    public RuleSet(Rule... rules) {

        this(Arrays.asList(rules));
    }

    public RuleSet(List<Rule> rules) {

        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    /**
     * Ingress rules of the system channel: empty envelopes, expired creators and
     * oversized envelopes are rejected before channel creation is considered.
     */
    public static RuleSet createSystemChannelFilters(ChainCreator chainCreator, SystemChannelSupport support, MetadataValidator validator) {

        return new RuleSet(
                new EmptyRejectRule(),
                new ExpirationRejectRule(),
                new SizeFilter(support),
                new SystemChannelFilter(support, chainCreator, validator));
    }

    @Override
    public void apply(Common.Envelope env) throws OrdererException {

        for (Rule rule : rules) {
            rule.apply(env);
        }
    }

    public List<Rule> getRules() {
        return rules;
    }
}
