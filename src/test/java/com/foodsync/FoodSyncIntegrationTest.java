package com.foodsync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.foodsync.client.entity.Client;
import com.foodsync.client.repository.ClientAddressRepository;
import com.foodsync.client.repository.ClientRepository;
import com.foodsync.common.cache.CacheKey;
import com.foodsync.common.cache.ResultCache;
import com.foodsync.eventlog.WebhookLog;
import com.foodsync.eventlog.WebhookLogRepository;
import com.foodsync.gloriafood.GloriaFoodClient;
import com.foodsync.menu.payload.MenuSnapshot;
import com.foodsync.menu.repository.*;
import com.foodsync.order.repository.OrderItemRepository;
import com.foodsync.order.repository.OrderRepository;
import com.foodsync.order.service.OrderIngestResult;
import com.foodsync.order.service.OrderNormalizer;
import com.foodsync.restaurant.repository.RestaurantRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.core.io.ClassPathResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class FoodSyncIntegrationTest {

    private static final String MASTER_KEY = "test-master-key";
    private static final String BEARER = "Bearer test-api-token";

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private ObjectMapper objectMapper;
    @Autowired
    private ResultCache resultCache;

    @MockBean
    private GloriaFoodClient gloriaFoodClient;

    @Autowired
    private OrderNormalizer orderNormalizer;
    @Autowired
    private OrderRepository orderRepository;
    @Autowired
    private OrderItemRepository orderItemRepository;
    @Autowired
    private ClientRepository clientRepository;
    @Autowired
    private ClientAddressRepository clientAddressRepository;
    @Autowired
    private RestaurantRepository restaurantRepository;
    @Autowired
    private WebhookLogRepository webhookLogRepository;
    @Autowired
    private MenuRepository menuRepository;
    @Autowired
    private MenuCategoryRepository categoryRepository;
    @Autowired
    private MenuItemRepository itemRepository;
    @Autowired
    private MenuItemSizeRepository sizeRepository;
    @Autowired
    private OptionGroupRepository optionGroupRepository;
    @Autowired
    private MenuOptionRepository menuOptionRepository;
    @Autowired
    private ItemOptionGroupRepository itemOptionGroupRepository;

    @AfterEach
    void cleanUp() {
        orderRepository.deleteAll();
        clientAddressRepository.deleteAllInBatch();
        clientRepository.deleteAllInBatch();
        restaurantRepository.deleteAllInBatch();

        itemOptionGroupRepository.deleteAllInBatch();
        sizeRepository.deleteAllInBatch();
        itemRepository.deleteAllInBatch();
        categoryRepository.deleteAllInBatch();
        menuOptionRepository.deleteAllInBatch();
        optionGroupRepository.deleteAllInBatch();
        menuRepository.deleteAllInBatch();

        webhookLogRepository.deleteAllInBatch();
        resultCache.invalidate(CacheKey.MENU_TREE);
        resultCache.invalidate(CacheKey.DASHBOARD_STATS);
    }

    private JsonNode fixture(String name) throws IOException {
        try (InputStream in = new ClassPathResource("fixtures/" + name).getInputStream()) {
            return objectMapper.readTree(in);
        }
    }

    private MenuSnapshot menuFixture(String name) throws IOException {
        return objectMapper.treeToValue(fixture(name), MenuSnapshot.class);
    }

    private String batchOf(JsonNode... orders) throws IOException {
        ObjectNode batch = objectMapper.createObjectNode();
        batch.put("count", orders.length);
        batch.putArray("orders").addAll(List.of(orders));
        return objectMapper.writeValueAsString(batch);
    }

    private ResultActions push(String authorization, String body) throws Exception {
        return mockMvc.perform(post("/webhook/orders")
                .header(HttpHeaders.AUTHORIZATION, authorization)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body));
    }

    private ResultActions syncMenu() throws Exception {
        return mockMvc.perform(post("/api/menu/sync").header(HttpHeaders.AUTHORIZATION, BEARER));
    }

    @Test
    @DisplayName("같은 주문을 두 번 받아도 한 번만 저장")
    void push_SameOrderTwice_StoredOnce() throws Exception {
        // Given
        String body = batchOf(fixture("order-555.json"));

        // When
        push(MASTER_KEY, body)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.orders", hasSize(1)));
        Long firstId = orderRepository.findByExternalIdAndPosSystemId(555L, 0L).orElseThrow().getId();

        push(MASTER_KEY, body)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.orders[0].orderId").value(firstId));

        // Then
        assertThat(orderRepository.count()).isEqualTo(1);
        assertThat(clientRepository.count()).isEqualTo(1);
        assertThat(clientAddressRepository.count()).isEqualTo(1);
        assertThat(restaurantRepository.count()).isEqualTo(1);
        assertThat(webhookLogRepository.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("restaurant_key 없는 최소 픽업 주문도 저장, 재전송은 중복 없음")
    void push_MinimalPickupWithoutRestaurant_Stored() throws Exception {
        // Given
        ObjectNode burger = objectMapper.createObjectNode();
        burger.put("id", 555);
        burger.put("pos_system_id", 0);
        burger.put("type", "pickup");
        burger.put("total_price", 12.5);
        ObjectNode item = burger.putArray("items").addObject();
        item.put("type", "item");
        item.put("name", "Burger");
        item.put("price", 12.5);
        item.put("quantity", 1);

        // When
        push(MASTER_KEY, batchOf(burger))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));
        push(MASTER_KEY, batchOf(burger)).andExpect(status().isOk());

        // Then
        assertThat(orderRepository.count()).isEqualTo(1);
        assertThat(restaurantRepository.count()).isZero();
        assertThat(clientRepository.count()).isZero();
    }

    @Test
    @DisplayName("같은 주문 id라도 POS 시스템이 다르면 별도 주문")
    void push_SameIdDifferentPos_TwoOrders() throws Exception {
        ObjectNode defaultPos = (ObjectNode) fixture("order-555.json");
        ObjectNode otherPos = defaultPos.deepCopy();
        otherPos.put("pos_system_id", 7);

        push(MASTER_KEY, batchOf(defaultPos, otherPos)).andExpect(status().isOk());

        assertThat(orderRepository.count()).isEqualTo(2);
        assertThat(orderRepository.findByExternalIdAndPosSystemId(555L, 0L)).isPresent();
        assertThat(orderRepository.findByExternalIdAndPosSystemId(555L, 7L)).isPresent();
    }

    @Test
    @DisplayName("재주문에 이메일이 없어도 저장된 이메일 유지")
    void push_RepeatClientWithoutEmail_KeepsEmail() throws Exception {
        // Given
        push(MASTER_KEY, batchOf(fixture("order-555.json"))).andExpect(status().isOk());
        ObjectNode repeat = (ObjectNode) fixture("order-555.json");
        repeat.put("id", 556);
        repeat.remove("client_email");
        repeat.put("client_first_name", "Anita");
        repeat.put("client_order_count", 4);

        // When
        push(MASTER_KEY, batchOf(repeat)).andExpect(status().isOk());

        // Then
        Client client = clientRepository.findByExternalId(7001L).orElseThrow();
        assertThat(client.getEmail()).isEqualTo("ana@example.com");
        assertThat(client.getFirstName()).isEqualTo("Anita");
        assertThat(client.getOrderCount()).isEqualTo(4);
        assertThat(clientAddressRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("마스터 키가 틀리면 401, 주문은 저장하지 않고 에러 이벤트 한 건")
    void push_WrongMasterKey_Unauthorized() throws Exception {
        push("wrong-key", batchOf(fixture("order-555.json")))
                .andExpect(status().isUnauthorized());

        assertThat(orderRepository.count()).isZero();
        List<WebhookLog> logs = webhookLogRepository.findAll();
        assertThat(logs).singleElement().satisfies(log -> {
            assertThat(log.getEventType()).isEqualTo("order_received");
            assertThat(log.getStatus()).isEqualTo("error");
            assertThat(log.getErrorMessage()).isEqualTo("Invalid master key");
        });
    }

    @Test
    @DisplayName("마스터 키가 틀리면 본문이 배치 형식이 아니어도 401, 에러 이벤트 기록")
    void push_WrongKeyAndMalformedBody_UnauthorizedAndLogged() throws Exception {
        push("wrong-key", "[1,2]").andExpect(status().isUnauthorized());

        assertThat(webhookLogRepository.findAll()).singleElement().satisfies(log -> {
            assertThat(log.getStatus()).isEqualTo("error");
            assertThat(log.getErrorMessage()).isEqualTo("Invalid master key");
        });
    }

    @Test
    @DisplayName("키가 맞고 본문이 배치 형식이 아니면 400, 에러 이벤트 기록")
    void push_MalformedBody_BadRequest() throws Exception {
        push(MASTER_KEY, "[1,2]")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value(endsWith("invalid_input")));

        assertThat(orderRepository.count()).isZero();
        assertThat(webhookLogRepository.findAll()).singleElement()
                .satisfies(log -> assertThat(log.getErrorMessage()).startsWith("Malformed order batch"));
    }

    @Test
    @DisplayName("주문 저장이 도중에 실패하면 고객, 매장, 주문, 항목 모두 남지 않음")
    void push_WriteFailsPartway_NothingStored() throws Exception {
        // Given
        ObjectNode order = (ObjectNode) fixture("order-555.json");
        ArrayNode items = (ArrayNode) order.get("items");
        ((ObjectNode) items.get(items.size() - 1)).put("instructions", "x".repeat(1001));

        // When
        push(MASTER_KEY, batchOf(order))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.data.orders[0].error").exists());

        // Then
        assertThat(orderRepository.count()).isZero();
        assertThat(orderItemRepository.count()).isZero();
        assertThat(clientRepository.count()).isZero();
        assertThat(clientAddressRepository.count()).isZero();
        assertThat(restaurantRepository.count()).isZero();
    }

    @Test
    @DisplayName("같은 주문을 동시에 수집하면 한 건만 저장, 나머지는 isNew=false")
    void ingest_SameOrderConcurrently_OneRow() throws Exception {
        // Given
        JsonNode order = fixture("order-555.json");
        int threads = 4;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<OrderIngestResult>> futures = new ArrayList<>();

        // When
        try {
            for (int i = 0; i < threads; i++) {
                Callable<OrderIngestResult> task = () -> {
                    start.await();
                    return orderNormalizer.ingest(order);
                };
                futures.add(executor.submit(task));
            }
            start.countDown();
        } finally {
            executor.shutdown();
        }
        assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        List<OrderIngestResult> results = new ArrayList<>();
        for (Future<OrderIngestResult> future : futures) {
            results.add(future.get());
        }

        // Then
        assertThat(results).filteredOn(OrderIngestResult::isNew).hasSize(1);
        assertThat(results).extracting(OrderIngestResult::internalId).containsOnly(results.get(0).internalId());
        assertThat(orderRepository.count()).isEqualTo(1);
        assertThat(clientRepository.count()).isEqualTo(1);
        assertThat(restaurantRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("일부 주문이 잘못되어도 200, success=false, 올바른 주문은 저장")
    void push_MixedBatch_PartialSuccess() throws Exception {
        ObjectNode invalid = (ObjectNode) fixture("order-555.json");
        invalid.put("id", 600);
        invalid.put("type", "dine_in");

        push(MASTER_KEY, batchOf(fixture("order-555.json"), invalid))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("1 of 2 orders failed"))
                .andExpect(jsonPath("$.data.orders[1].externalId").value(600))
                .andExpect(jsonPath("$.data.orders[1].error").exists());

        assertThat(orderRepository.count()).isEqualTo(1);
        assertThat(webhookLogRepository.findAll()).singleElement()
                .satisfies(log -> assertThat(log.getStatus()).isEqualTo("error"));
    }

    @Test
    @DisplayName("주문 상세 조회는 API 토큰이 필요하고 전체 항목을 반환")
    void getOrder_RequiresTokenAndReturnsDetails() throws Exception {
        push(MASTER_KEY, batchOf(fixture("order-555.json"))).andExpect(status().isOk());
        Long id = orderRepository.findByExternalIdAndPosSystemId(555L, 0L).orElseThrow().getId();

        mockMvc.perform(get("/api/orders/{id}", id))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(get("/api/orders/{id}", id).header(HttpHeaders.AUTHORIZATION, BEARER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.externalId").value(555))
                .andExpect(jsonPath("$.data.paymentMethod").value("CARD"))
                .andExpect(jsonPath("$.data.items", hasSize(3)))
                .andExpect(jsonPath("$.data.items[0].options", hasSize(1)))
                .andExpect(jsonPath("$.data.taxes", hasSize(1)))
                .andExpect(jsonPath("$.data.coupons[0]").value("WELCOME10"))
                .andExpect(jsonPath("$.data.billing.companyName").value("Acme SL"));

        mockMvc.perform(get("/api/orders/{id}", id + 1000).header(HttpHeaders.AUTHORIZATION, BEARER))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("주문 저장 후 대시보드 통계에 반영")
    void dashboard_ReflectsStoredOrders() throws Exception {
        mockMvc.perform(get("/api/stats/dashboard").header(HttpHeaders.AUTHORIZATION, BEARER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.today.orders").value(0));

        push(MASTER_KEY, batchOf(fixture("order-555.json"))).andExpect(status().isOk());

        mockMvc.perform(get("/api/stats/dashboard").header(HttpHeaders.AUTHORIZATION, BEARER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.today.orders").value(1))
                .andExpect(jsonPath("$.data.ordersByType.delivery").value(1));
    }

    @Test
    @DisplayName("동기화 전 메뉴 조회는 404")
    void getMenu_BeforeFirstSync_NotFound() throws Exception {
        mockMvc.perform(get("/api/menu").header(HttpHeaders.AUTHORIZATION, BEARER))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("공유 옵션 그룹은 한 번만 저장되고 아이템마다 링크")
    void syncMenu_SharedGroup_StoredOnce() throws Exception {
        // Given
        given(gloriaFoodClient.fetchMenu()).willReturn(menuFixture("menu-v1.json"));

        // When
        syncMenu()
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.categories").value(2))
                .andExpect(jsonPath("$.data.items").value(3))
                .andExpect(jsonPath("$.data.sizes").value(2))
                .andExpect(jsonPath("$.data.optionGroups").value(2))
                .andExpect(jsonPath("$.data.options").value(4));

        // Then
        assertThat(optionGroupRepository.count()).isEqualTo(2);
        assertThat(menuOptionRepository.count()).isEqualTo(4);
        assertThat(itemOptionGroupRepository.count()).isEqualTo(3);
        assertThat(webhookLogRepository.findAll()).singleElement().satisfies(log -> {
            assertThat(log.getEventType()).isEqualTo("menu_sync");
            assertThat(log.getStatus()).isEqualTo("success");
        });
    }

    @Test
    @DisplayName("재동기화는 이전 하위 트리를 남기지 않고 캐시된 메뉴도 갱신")
    void syncMenu_Twice_ReplacesTreeAndCache() throws Exception {
        // Given
        given(gloriaFoodClient.fetchMenu()).willReturn(menuFixture("menu-v1.json"));
        syncMenu().andExpect(status().isOk());
        mockMvc.perform(get("/api/menu").header(HttpHeaders.AUTHORIZATION, BEARER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.categories", hasSize(2)))
                .andExpect(jsonPath("$.data.categories[0].items[0].name").value("Margherita"))
                .andExpect(jsonPath("$.data.categories[0].items[0].kitchenInternalName").value("PZ-MARG"))
                .andExpect(jsonPath("$.data.categories[0].items[0].extras.spicy_level").value(0))
                .andExpect(jsonPath("$.data.categories[0].items[0].sizes[1].groups[0].name").value("Crust"))
                .andExpect(jsonPath("$.data.categories[0].items[0].groups[0].options", hasSize(2)));

        // When
        given(gloriaFoodClient.fetchMenu()).willReturn(menuFixture("menu-v2.json"));
        syncMenu()
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.optionGroups").value(0));

        // Then
        assertThat(menuRepository.count()).isEqualTo(1);
        assertThat(categoryRepository.count()).isEqualTo(1);
        assertThat(itemRepository.count()).isEqualTo(1);
        assertThat(sizeRepository.count()).isZero();
        assertThat(itemOptionGroupRepository.count()).isEqualTo(1);
        assertThat(optionGroupRepository.count()).isEqualTo(2);

        mockMvc.perform(get("/api/menu").header(HttpHeaders.AUTHORIZATION, BEARER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.categories", hasSize(1)))
                .andExpect(jsonPath("$.data.categories[0].items[0].name").value("Diavola Picante"));
    }

    @Test
    @DisplayName("메뉴 조회 실패 시 기존 트리는 그대로, 에러 이벤트 기록")
    void syncMenu_FetchFails_TreeUntouched() throws Exception {
        // Given
        given(gloriaFoodClient.fetchMenu()).willReturn(menuFixture("menu-v1.json"));
        syncMenu().andExpect(status().isOk());

        given(gloriaFoodClient.fetchMenu()).willThrow(new IllegalStateException("503 Service Unavailable"));

        // When
        syncMenu()
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.detail").value("Error fetching menu: 503 Service Unavailable"));

        // Then
        assertThat(itemRepository.count()).isEqualTo(3);
        assertThat(webhookLogRepository.findAll())
                .extracting(WebhookLog::getStatus)
                .containsExactlyInAnyOrder("success", "error");

        mockMvc.perform(get("/api/menu").header(HttpHeaders.AUTHORIZATION, BEARER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.categories", hasSize(2)));
    }

    @Test
    @DisplayName("동기화가 재구성 도중 실패하면 이전 트리가 그대로 남음")
    void syncMenu_RebuildFails_PreviousTreeKept() throws Exception {
        // Given
        given(gloriaFoodClient.fetchMenu()).willReturn(menuFixture("menu-v1.json"));
        syncMenu().andExpect(status().isOk());

        ObjectNode broken = (ObjectNode) fixture("menu-v1.json");
        ObjectNode water = (ObjectNode) broken.get("categories").get(1).get("items").get(0);
        water.putArray("groups").addObject().put("name", "Ice");
        given(gloriaFoodClient.fetchMenu()).willReturn(objectMapper.treeToValue(broken, MenuSnapshot.class));

        // When
        syncMenu().andExpect(status().isBadRequest());

        // Then
        assertThat(categoryRepository.count()).isEqualTo(2);
        assertThat(itemRepository.count()).isEqualTo(3);
        assertThat(itemOptionGroupRepository.count()).isEqualTo(3);

        resultCache.invalidate(CacheKey.MENU_TREE);
        mockMvc.perform(get("/api/menu").header(HttpHeaders.AUTHORIZATION, BEARER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.categories", hasSize(2)));
    }

    @Test
    @DisplayName("로그 조회 limit이 1 미만이면 400 INVALID_INPUT")
    void getLogs_NonPositiveLimit_BadRequest() throws Exception {
        push(MASTER_KEY, batchOf(fixture("order-555.json"))).andExpect(status().isOk());
        push(MASTER_KEY, batchOf(fixture("order-555.json"))).andExpect(status().isOk());

        mockMvc.perform(get("/api/logs").param("limit", "0").header(HttpHeaders.AUTHORIZATION, BEARER))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value(endsWith("invalid_input")));

        mockMvc.perform(get("/api/logs").param("limit", "1").header(HttpHeaders.AUTHORIZATION, BEARER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(1)));
    }
}
