package service.klipper.impl;

import com.fasterxml.jackson.databind.JsonNode;
import common.config.KlipperConfig;
import common.consts.ErrorCodes;
import common.exception.HomingRequiredException;
import common.exception.KlipperConnectionException;
import common.exception.KlipperException;
import common.exception.KlipperInternalException;
import common.exception.KlipperResponseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import service.klipper.KlipperApi;
import service.motion.GcodeEncoder;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * 基于 RestTemplate 的 Klipper API 实现
 * 每次调用都是一次独立的请求 受 30 秒超时约束，响应在任何退出路径上都会被释放
 */
@Slf4j
@Service
public class KlipperClient implements KlipperApi {

    private static final String INFO_PATH = "/printer/info";
    private static final String GCODE_PATH = "/printer/gcode/script";
    private static final int INFO_ERROR_TEXT_LIMIT = 50;

    private final RestTemplate restTemplate;
    private final KlipperConfig config;

    public KlipperClient(RestTemplate klipperRestTemplate, KlipperConfig config) {
        this.restTemplate = klipperRestTemplate;
        this.config = config;
    }

    @Override
    public JsonNode getPrinterInfo() {
        try {
            return exchange(HttpMethod.GET, INFO_PATH, null);
        } catch (RestClientResponseException e) {
            String text = abbreviate(responseText(e), INFO_ERROR_TEXT_LIMIT);
            throw new KlipperResponseException(ErrorCodes.PRINTER_INFO_FAILED, ErrorCodes.KLIPPER_HTTP_ERROR,
                    e.getStatusCode().value(), text);
        } catch (ResourceAccessException e) {
            throw connectionError(e);
        } catch (RuntimeException e) {
            throw new KlipperInternalException(e);
        }
    }

    @Override
    public JsonNode sendGcode(String script) {
        log.debug("发送 G-code ({} 行)", GcodeEncoder.countLines(script));
        try {
            return exchange(HttpMethod.POST, GCODE_PATH, Map.of("script", script));
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            String text = responseText(e);
            if (HomingRequiredException.matches(text)) {
                throw new HomingRequiredException(status, text);
            }
            throw new KlipperResponseException(ErrorCodes.GCODE_SEND_FAILED, ErrorCodes.KLIPPER_GCODE_ERROR,
                    status, text);
        } catch (ResourceAccessException e) {
            throw connectionError(e);
        } catch (KlipperException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new KlipperInternalException(e);
        }
    }

    @Override
    public JsonNode homePrinter() {
        return sendGcode(GcodeEncoder.HOME_ALL);
    }

    @Override
    public JsonNode pausePrinter() {
        return sendGcode(GcodeEncoder.PAUSE);
    }

    private JsonNode exchange(HttpMethod method, String path, Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (body != null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }
        ResponseEntity<JsonNode> response = restTemplate.exchange(
                config.getBaseUrl() + path, method, new HttpEntity<>(body, headers), JsonNode.class);
        return response.getBody();
    }

    // Moonraker 的错误文本不一定声明 charset 按 UTF-8 解码
    private static String responseText(RestClientResponseException e) {
        return e.getResponseBodyAsString(StandardCharsets.UTF_8).trim();
    }

    private KlipperConnectionException connectionError(ResourceAccessException e) {
        log.warn("Klipper 服务器连接失败: {}", e.getMessage());
        return new KlipperConnectionException("服务器连接失败 URL: " + config.getBaseUrl(), e);
    }

    private static String abbreviate(String text, int limit) {
        return text.length() <= limit ? text : text.substring(0, limit);
    }
}
