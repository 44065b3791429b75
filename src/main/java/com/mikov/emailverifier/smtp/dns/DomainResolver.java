package com.mikov.emailverifier.smtp.dns;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.xbill.DNS.Lookup;
import org.xbill.DNS.MXRecord;
import org.xbill.DNS.Name;
import org.xbill.DNS.Record;
import org.xbill.DNS.Resolver;
import org.xbill.DNS.TXTRecord;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * DNS checks for a receiving domain: existence, mail exchangers and SPF.
 * Every lookup is a single attempt; callers decide what a failure means.
 *
 * @author zahari.mikov
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DomainResolver {
    private static final String SPF_MARKER = "v=spf1";
    private static final Record[] NO_RECORDS = new Record[0];

    private final Resolver resolver;

    /**
     * Checks that the domain resolves to at least one IPv4 or IPv6 address.
     */
    public boolean hostExists(String domain) throws DomainResolutionException {
        if (lookup(domain, Type.A).length > 0) {
            return true;
        }
        return lookup(domain, Type.AAAA).length > 0;
    }

    /**
     * Resolves the domain's mail exchangers, most preferred first. Null MX
     * entries (target ".") are dropped.
     *
     * @return the exchangers, empty when the domain publishes none
     */
    public List<MxRecord> resolveMailExchangers(String domain) throws DomainResolutionException {
        final var mxRecords = new ArrayList<MxRecord>();
        for (final var record : lookup(domain, Type.MX)) {
            if (record instanceof MXRecord mx && !Name.root.equals(mx.getTarget())) {
                mxRecords.add(new MxRecord(mx.getTarget().toString(true), mx.getPriority()));
            }
        }

        mxRecords.sort(Comparator.comparingInt(MxRecord::priority));
        log.debug("Resolved {} MX records for {}: {}", mxRecords.size(), domain, mxRecords);
        return mxRecords;
    }

    /**
     * Checks whether any TXT record of the domain declares an SPF policy.
     */
    public boolean hasSpfRecord(String domain) throws DomainResolutionException {
        for (final var record : lookup(domain, Type.TXT)) {
            if (record instanceof TXTRecord txt && String.join("", txt.getStrings()).contains(SPF_MARKER)) {
                return true;
            }
        }
        return false;
    }

    private Record[] lookup(String domain, int type) throws DomainResolutionException {
        final Lookup lookup;
        try {
            lookup = new Lookup(Name.fromString(domain, Name.root), type);
        } catch (TextParseException e) {
            throw new DomainResolutionException(domain, Type.string(type), e);
        }
        lookup.setResolver(resolver);

        final var records = lookup.run();
        switch (lookup.getResult()) {
            case Lookup.SUCCESSFUL:
                return records != null ? records : NO_RECORDS;
            case Lookup.HOST_NOT_FOUND:
            case Lookup.TYPE_NOT_FOUND:
                return NO_RECORDS;
            default:
                log.warn("{} lookup for {} failed: {}", Type.string(type), domain, lookup.getErrorString());
                throw new DomainResolutionException(domain, Type.string(type), lookup.getErrorString());
        }
    }
}
