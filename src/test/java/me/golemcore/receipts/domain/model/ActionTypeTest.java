package me.golemcore.receipts.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ActionTypeTest {

    @Test
    void resolvesKnownActions() {
        assertEquals(ActionType.UPDATE, ActionType.resolve("update_lead"));
        assertEquals(ActionType.SEND, ActionType.resolve("send_sms"));
        assertEquals(ActionType.CREATE, ActionType.resolve("createContact"));
        assertEquals(ActionType.DELETE, ActionType.resolve("DELETE_RECORD"));
        assertEquals(ActionType.READ, ActionType.resolve("get_invoice"));
        assertEquals(ActionType.SEARCH, ActionType.resolve("search_deals"));
        assertEquals(ActionType.PAYMENT, ActionType.resolve("refund"));
    }

    @Test
    void earlierTagWinsWhenSeveralMatch() {
        assertEquals(ActionType.CREATE, ActionType.resolve("create_payment"));
    }

    @Test
    void keywordsInsideNounsDoNotMatch() {
        assertEquals(ActionType.UPDATE, ActionType.resolve("update_address"));
        assertEquals(ActionType.UPDATE, ActionType.resolve("update_budget"));
        assertEquals(ActionType.DELETE, ActionType.resolve("delete_target"));
        assertEquals(ActionType.DELETE, ActionType.resolve("delete_playlist"));
        assertEquals(ActionType.OTHER, ActionType.resolve("address_book"));
    }

    @Test
    void splitsOnHyphensAndCamelCase() {
        assertEquals(ActionType.DELETE, ActionType.resolve("delete-playlist"));
        assertEquals(ActionType.UPDATE, ActionType.resolve("updateAddress"));
        assertEquals(ActionType.READ, ActionType.resolve("listTargets"));
        assertEquals(ActionType.SEND, ActionType.resolve("bulk.send.digest"));
    }

    @Test
    void leadingVerbWinsOverLaterWords() {
        assertEquals(ActionType.UPDATE, ActionType.resolve("update_payment_method"));
        assertEquals(ActionType.PAYMENT, ActionType.resolve("refund_order"));
        assertEquals(ActionType.SEARCH, ActionType.resolve("contacts_search"));
    }

    @Test
    void unknownOrBlankIsOther() {
        assertEquals(ActionType.OTHER, ActionType.resolve("sync"));
        assertEquals(ActionType.OTHER, ActionType.resolve(" "));
        assertEquals(ActionType.OTHER, ActionType.resolve(null));
    }
}
