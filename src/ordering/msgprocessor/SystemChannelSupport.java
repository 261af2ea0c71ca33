/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package ordering.msgprocessor;

import java.util.Optional;

/**
 * Read access to the live configuration of the system channel.
 *
 * @author joao
 */
public interface SystemChannelSupport {

    Optional<OrdererConfig> getOrdererConfig();
}
