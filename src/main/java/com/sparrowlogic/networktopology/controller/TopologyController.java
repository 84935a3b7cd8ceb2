package com.sparrowlogic.networktopology.controller;

import com.sparrowlogic.networktopology.exception.ProvisioningException;
import com.sparrowlogic.networktopology.service.CreateOrchestrator;
import com.sparrowlogic.networktopology.service.TeardownOrchestrator;
import com.sparrowlogic.networktopology.service.TopologyCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;

@Controller
public class TopologyController {

    private static final Logger logger = LoggerFactory.getLogger(TopologyController.class);

    private final CreateOrchestrator createOrchestrator;
    private final TeardownOrchestrator teardownOrchestrator;
    private final TopologyCollector collector;

    public TopologyController(CreateOrchestrator createOrchestrator, TeardownOrchestrator teardownOrchestrator,
                              TopologyCollector collector) {
        this.createOrchestrator = createOrchestrator;
        this.teardownOrchestrator = teardownOrchestrator;
        this.collector = collector;
    }

    @GetMapping("/")
    public String showForm() {
        return "form";
    }

    @PostMapping("/create")
    public String create(@RequestParam String region, @RequestParam String prefix, @RequestParam String keyName,
                         Model model) {
        model.addAttribute("operation", "create");
        try {
            model.addAttribute("topology", createOrchestrator.create(region, prefix, keyName));
            return "index";
        } catch (ProvisioningException e) {
            model.addAttribute("error", e.getMessage());
            model.addAttribute("partial", e.partial());
            return "error";
        } catch (Exception e) {
            logger.error("Create of {} in {} failed", prefix, region, e);
            model.addAttribute("error", "Error creating topology: " + e.getMessage());
            return "error";
        }
    }

    @PostMapping("/teardown")
    public String teardown(@RequestParam String region, @RequestParam String prefix, Model model) {
        model.addAttribute("operation", "teardown");
        try {
            model.addAttribute("report", teardownOrchestrator.teardown(region, prefix));
            return "index";
        } catch (Exception e) {
            logger.error("Teardown of {} in {} failed", prefix, region, e);
            model.addAttribute("error", "Error tearing down topology: " + e.getMessage());
            return "error";
        }
    }

    @PostMapping("/collect")
    public String collect(@RequestParam String region, @RequestParam String prefix, Model model) {
        model.addAttribute("operation", "collect");
        try {
            model.addAttribute("files", collector.collect(region, prefix).stream().map(Object::toString).toList());
            return "index";
        } catch (Exception e) {
            logger.error("Collect of {} in {} failed", prefix, region, e);
            model.addAttribute("error", "Error collecting topology: " + e.getMessage());
            return "error";
        }
    }
}
