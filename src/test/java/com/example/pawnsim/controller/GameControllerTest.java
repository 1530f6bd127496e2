package com.example.pawnsim.controller;

import com.example.pawnsim.service.GameLoopService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {"pawnsim.loop-enabled=false", "pawnsim.seed=7"})
@AutoConfigureMockMvc
class GameControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private GameLoopService gameLoopService;

    @BeforeEach
    void resetWorld() {
        gameLoopService.reset();
    }

    @Test
    void gameStateHasWorldAndLogs() throws Exception {
        mockMvc.perform(get("/api/gamestate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.world.pawns.length()").value(4))
                .andExpect(jsonPath("$.world.buildings.length()").value(7))
                .andExpect(jsonPath("$.world.time.timeString").value("Day 1, 08:00"))
                .andExpect(jsonPath("$.world.pawns[0].name").value("Alex"))
                .andExpect(jsonPath("$.logs", hasItem("World reset")));
    }

    @Test
    void spawnReturnsTheNewPawn() throws Exception {
        mockMvc.perform(post("/api/pawns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Casey\",\"x\":10,\"y\":10,\"needs\":{\"Hunger\":50},\"gold\":12}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("Casey"))
                .andExpect(jsonPath("$.x").value(10))
                .andExpect(jsonPath("$.gold").value(12))
                .andExpect(jsonPath("$.needs.Hunger").value(50.0));

        mockMvc.perform(get("/api/gamestate"))
                .andExpect(jsonPath("$.world.pawns.length()").value(5));
    }

    @Test
    void unknownNeedIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/pawns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Casey\",\"x\":10,\"y\":10,\"needs\":{\"Thirst\":50}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown need: Thirst"));
    }

    @Test
    void spawnOutsideTheWorldIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/pawns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Casey\",\"x\":99,\"y\":0}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void blankNameIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/pawns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\" \",\"x\":1,\"y\":1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Pawn name is required"));
    }

    @Test
    void resetRebuildsTheWorld() throws Exception {
        mockMvc.perform(post("/api/pawns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Casey\",\"x\":10,\"y\":10}"))
                .andExpect(status().isCreated());

        mockMvc.perform(post("/api/world/reset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.world.pawns.length()").value(4));
    }
}
