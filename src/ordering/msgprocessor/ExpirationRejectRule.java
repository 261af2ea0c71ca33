/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package ordering.msgprocessor;

import java.security.cert.X509Certificate;
import java.util.Date;
import java.util.function.Supplier;
import ordering.util.OrdererCommon;
import org.hyperledger.fabric.protos.common.Common;

/**
 * Rejects envelopes signed by an identity whose certificate has expired.
 * Envelopes without a parseable creator are left to the rules that follow.
 *
 * @author joao
 */
public class ExpirationRejectRule implements Rule {

    private final Supplier<Date> clock;

    public ExpirationRejectRule() {

        this(Date::new);
    }

    public ExpirationRejectRule(Supplier<Date> clock) {

        this.clock = clock;
    }

    @Override
    public void apply(Common.Envelope env) throws FilterException {

        X509Certificate cert = OrdererCommon.extractCreatorCertificate(env);

        if (cert == null) return;

        Date now = clock.get();

        if (cert.getNotAfter().before(now)) {
            throw new FilterException(FilterException.Kind.IDENTITY_EXPIRED,
                    "broadcast client identity expired at " + cert.getNotAfter().toInstant());
        }
    }
}
