/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package ordering.deliver;

import ordering.util.OrdererCommon.OrdererException;

/**
 * Local ledger state consulted before (re)connecting to the ordering service.
 *
 * @author joao
 */
public interface LedgerInfo {

    /**
     * Number of blocks in the local ledger, read as an unsigned value. Zero means
     * the ledger is empty.
     */
    long getLedgerHeight() throws OrdererException;
}
