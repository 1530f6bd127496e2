package com.example.pawnsim.engine.system;

import com.example.pawnsim.content.BuildingDef;
import com.example.pawnsim.entity.EntityStore;
import com.example.pawnsim.model.EntityId;
import com.example.pawnsim.model.component.GoldComponent;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

@Slf4j
public final class Economy {

    private Economy() {
    }

    public static boolean canAfford(EntityStore entities, EntityId payer, int amount) {
        return amount <= 0 || entities.getGold().get(payer).map(g -> g.getAmount() >= amount).orElse(false);
    }

    public static boolean transfer(EntityStore entities, EntityId from, EntityId to, int amount) {
        if (amount <= 0) {
            return true;
        }
        Optional<GoldComponent> payer = entities.getGold().get(from);
        Optional<GoldComponent> payee = entities.getGold().get(to);
        if (payer.isEmpty() || payee.isEmpty() || payer.get().getAmount() < amount) {
            return false;
        }
        payer.get().setAmount(payer.get().getAmount() - amount);
        payee.get().setAmount(payee.get().getAmount() + amount);
        return true;
    }

    /**
     * Worker pays the buy-in, building pays the payout. Both legs are checked first so a
     * shortfall on either side leaves every balance untouched.
     */
    public static boolean settleWork(EntityStore entities, EntityId worker, EntityId building, BuildingDef def) {
        int buyIn = def.getWorkBuyIn();
        int payout = def.getPayout();
        Optional<GoldComponent> workerGold = entities.getGold().get(worker);
        Optional<GoldComponent> buildingGold = entities.getGold().get(building);
        if (workerGold.isEmpty() || buildingGold.isEmpty()) {
            return false;
        }
        if (workerGold.get().getAmount() < buyIn || buildingGold.get().getAmount() + buyIn < payout) {
            log.debug("Work at {} not settled: worker has {}, building has {}, buy-in {}, payout {}",
                    def.getName(), workerGold.get().getAmount(), buildingGold.get().getAmount(), buyIn, payout);
            return false;
        }
        transfer(entities, worker, building, buyIn);
        transfer(entities, building, worker, payout);
        return true;
    }

    /** Destination pays the source for delivered goods when it can; returns the amount paid. */
    public static int payWholesale(EntityStore entities, EntityId destination, EntityId source, int delivered, float pricePerUnit) {
        int amount = (int) Math.floor(delivered * pricePerUnit);
        if (amount <= 0 || source == null || !entities.getGold().contains(source)) {
            return 0;
        }
        return transfer(entities, destination, source, amount) ? amount : 0;
    }
}
