package com.ledgerlens.backend.services.imports.description.sbi;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.util.Map;

import org.junit.jupiter.api.Test;

import com.ledgerlens.backend.enums.NarrationType;
import com.ledgerlens.backend.services.imports.description.DescriptionParseResult;

class SbiNarrationParserTest {

    private final SbiNarrationParser parser = new SbiNarrationParser();

    @Test
    void upiDebit() {
        DescriptionParseResult r = parser.parse(
                "WDL TFR UPI/DR/931523643407/SHAIK YA/SBIN/skya smeen1/Paym... AT 04413 PBB NELLORE");

        assertEquals("SHAIK YA", r.merchant());
        assertEquals(NarrationType.UPI, r.type());
        assertEquals("UPI Transfer to SHAIK YA", r.cleanDescription());
        assertEquals(Map.of("utr", "931523643407", "bank", "SBIN", "mode", "DR", "app", "Paym"), r.meta());
    }

    @Test
    void upiCredit() {
        DescriptionParseResult r = parser.parse("DEP TFR UPI/CR/412345678901/RAHUL KU/HDFC/rahul@okhd/BHIM");

        assertEquals("UPI Received from RAHUL KU", r.cleanDescription());
        assertEquals("CR", r.meta().get("mode"));
    }

    @Test
    void atmWithdrawal() {
        DescriptionParseResult r = parser.parse("ATM WDL ATM CASH 1957 SP OFFICE DARGAMITTA, NELLORE");

        assertEquals("ATM Withdrawal", r.merchant());
        assertEquals(NarrationType.ATM, r.type());
        assertEquals("ATM Cash Withdrawal at OFFICE DARGAMITTA, NELLORE", r.cleanDescription());
        assertEquals("1957 SP", r.meta().get("atmId"));
    }

    @Test
    void posPurchaseStripsCardReference() {
        DescriptionParseResult r = parser.parse("POS ATM PURCH OTHPG 3155010693 17Pho*PHONEPE RECHARGE BANGALORE");

        assertEquals("PhonePe", r.merchant());
        assertEquals(NarrationType.POS, r.type());
        assertEquals("POS Purchase at PhonePe (BANGALORE)", r.cleanDescription());
        assertEquals("OTHPG", r.meta().get("gateway"));
        assertEquals("3155010693", r.meta().get("ref"));
    }

    @Test
    void internetBanking() {
        assertEquals("Online Transfer to Amazon", parser.parse("WDL TFR INB Amazon Seller Services... AT 04413 PBB NELLORE").cleanDescription());
        assertEquals("Online Transfer: Gift Card", parser.parse("WDL TFR INB Gift Card AT 04413 PBB NELLORE").cleanDescription());
    }

    @Test
    void deposits() {
        DescriptionParseResult self = parser.parse("CASH DEPOSIT SELF AT 04413 PBB NELLORE");
        assertEquals("Self Deposit", self.merchant());
        assertEquals(NarrationType.CASH_DEPOSIT, self.type());
        assertEquals("Cash Deposit at 04413 PBB NELLORE", self.cleanDescription());

        DescriptionParseResult cdm = parser.parse("CEMTEX DEP 0012345678 NELLORE");
        assertEquals("Cash Deposit Machine", cdm.merchant());
        assertEquals("CDM Deposit (Ref: 0012345678)", cdm.cleanDescription());
    }

    @Test
    void refundAndMerchantTransfer() {
        assertEquals("Refund from Zomato", parser.parse("DEP TFR REFUND FROM ZOMATO LTD").cleanDescription());
        assertEquals("Payment to Netflix", parser.parse("WDL TFR NETFLIX SUBSCRIPTION").cleanDescription());
    }

    @Test
    void unknownNarrationPassesThrough() {
        DescriptionParseResult r = parser.parse("SOME RANDOM STRING 123");

        assertEquals("Unknown", r.merchant());
        assertEquals(NarrationType.UNKNOWN, r.type());
        assertEquals("SOME RANDOM STRING 123", r.cleanDescription());
        assertFalse(r.isResolved());
    }
}
