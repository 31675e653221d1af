package com.plyoox.stream.notifier.restClients;

import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.cloud.openfeign.SpringQueryMap;
import org.springframework.web.bind.annotation.GetMapping;

import java.util.Map;

@FeignClient(name = "bot", url = "${bot.url}")
public interface BotNotificationClient {

    @GetMapping
    void notifyStreamOnline(@SpringQueryMap Map<String, ?> params);
}
