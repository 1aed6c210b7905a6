package io.hyperfoil.tools.multishell.config;

import io.hyperfoil.tools.multishell.SecretFilter;
import io.hyperfoil.tools.multishell.ResponseCollector;
import org.apache.sshd.common.channel.PtyMode;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings for one interactive shell session. Unset values are filled in by {@link #applyDefaults()}.
 */
public class SessionConfig {

    public static final String DEFAULT_SHELL = "/bin/bash";
    public static final String DEFAULT_TERM = "vt100";
    public static final int DEFAULT_ROWS = 80;
    public static final int DEFAULT_COLUMNS = 10 * 1024; //wide enough that long commands do not wrap with " \r"
    public static final int DEFAULT_TTY_SPEED = 14_400;
    public static final int DEFAULT_PROMPT_TIMEOUT = 1_000;
    public static final String DEFAULT_KERNEL_COMMAND = "uname -s";
    public static final int DEFAULT_KERNEL_TIMEOUT = 20_000;
    public static final List<String> DEFAULT_KERNEL_TERMINATORS = Collections.unmodifiableList(Arrays.asList("Linux", "Darwin", "$", "#"));

    private String name = "";
    private String shell;
    private String term;
    private int rows;
    private int columns;
    private Map<String,String> environment = new LinkedHashMap<>();
    private int timeout;
    private int bannerTimeout;
    private int promptTimeout;
    private String kernelCommand;
    private int kernelTimeout;
    private boolean trace = false;
    private SecretFilter filter = new SecretFilter();

    public SessionConfig(){}

    public SessionConfig applyDefaults(){
        if(name == null){
            name = "";
        }
        if(shell == null || shell.isBlank()){
            shell = DEFAULT_SHELL;
        }
        if(term == null || term.isBlank()){
            term = DEFAULT_TERM;
        }
        if(rows <= 0){
            rows = DEFAULT_ROWS;
        }
        if(columns <= 0){
            columns = DEFAULT_COLUMNS;
        }
        if(environment == null){
            environment = new LinkedHashMap<>();
        }
        if(timeout <= 0){
            timeout = ResponseCollector.DEFAULT_TIMEOUT_MS;
        }
        if(bannerTimeout <= 0){
            bannerTimeout = timeout;
        }
        if(promptTimeout <= 0){
            promptTimeout = DEFAULT_PROMPT_TIMEOUT;
        }
        if(kernelCommand == null || kernelCommand.isBlank()){
            kernelCommand = DEFAULT_KERNEL_COMMAND;
        }
        if(kernelTimeout <= 0){
            kernelTimeout = DEFAULT_KERNEL_TIMEOUT;
        }
        if(filter == null){
            filter = new SecretFilter();
        }
        return this;
    }

    /**
     * Terminal modes for the pseudo-terminal: no echo and a fixed line speed.
     */
    public Map<PtyMode,Integer> getTerminalModes(){
        Map<PtyMode,Integer> rtrn = new EnumMap<>(PtyMode.class);
        rtrn.put(PtyMode.ECHO, 0);
        rtrn.put(PtyMode.TTY_OP_ISPEED, DEFAULT_TTY_SPEED);
        rtrn.put(PtyMode.TTY_OP_OSPEED, DEFAULT_TTY_SPEED);
        return rtrn;
    }

    public String getName() {return name;}
    public boolean hasName(){return name != null && !name.isEmpty();}
    public SessionConfig setName(String name) {
        this.name = name;
        return this;
    }

    public String getShell() {return shell;}
    public SessionConfig setShell(String shell) {
        this.shell = shell;
        return this;
    }

    public String getTerm() {return term;}
    public SessionConfig setTerm(String term) {
        this.term = term;
        return this;
    }

    public int getRows() {return rows;}
    public SessionConfig setRows(int rows) {
        this.rows = rows;
        return this;
    }

    public int getColumns() {return columns;}
    public SessionConfig setColumns(int columns) {
        this.columns = columns;
        return this;
    }

    public Map<String, String> getEnvironment() {return Collections.unmodifiableMap(environment);}
    public SessionConfig setEnvironment(Map<String, String> environment) {
        this.environment = environment == null ? new LinkedHashMap<>() : new LinkedHashMap<>(environment);
        return this;
    }
    public SessionConfig addEnvironment(String key, String value){
        environment.put(key,value);
        return this;
    }

    public int getTimeout() {return timeout;}
    public SessionConfig setTimeout(int timeout) {
        this.timeout = timeout;
        return this;
    }

    public int getBannerTimeout() {return bannerTimeout;}
    public SessionConfig setBannerTimeout(int bannerTimeout) {
        this.bannerTimeout = bannerTimeout;
        return this;
    }

    public int getPromptTimeout() {return promptTimeout;}
    public SessionConfig setPromptTimeout(int promptTimeout) {
        this.promptTimeout = promptTimeout;
        return this;
    }

    public String getKernelCommand() {return kernelCommand;}
    public SessionConfig setKernelCommand(String kernelCommand) {
        this.kernelCommand = kernelCommand;
        return this;
    }

    public int getKernelTimeout() {return kernelTimeout;}
    public SessionConfig setKernelTimeout(int kernelTimeout) {
        this.kernelTimeout = kernelTimeout;
        return this;
    }

    public boolean isTrace() {return trace;}
    public SessionConfig setTrace(boolean trace) {
        this.trace = trace;
        return this;
    }

    public SecretFilter getFilter() {return filter;}
    public SessionConfig setFilter(SecretFilter filter) {
        this.filter = filter;
        return this;
    }
}
