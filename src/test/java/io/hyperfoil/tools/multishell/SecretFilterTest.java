package io.hyperfoil.tools.multishell;

import io.hyperfoil.tools.multishell.shell.SshConnector;
import org.junit.Test;

import java.util.Iterator;

import static io.hyperfoil.tools.multishell.SecretFilter.REPLACEMENT;
import static org.junit.Assert.*;

public class SecretFilterTest {

   @Test
   public void secret_order(){
      SecretFilter filter = new SecretFilter();
      filter.addSecret("barb");
      filter.addSecret("bara");
      filter.addSecret("barbar");

      Iterator<String> iter = filter.getSecrets().iterator();
      assertTrue(iter.hasNext());
      assertEquals("first entry should be longest","barbar",iter.next());
      assertEquals("second entry should be alphabetical","bara",iter.next());
      assertEquals("third entry should be alphabetical","barb",iter.next());
      assertFalse(iter.hasNext());
   }

   @Test
   public void secret_contains_another_secret(){
      SecretFilter filter = new SecretFilter();
      filter.addSecret("bar");
      filter.addSecret("foobar");
      String output = filter.filter("foobar");
      assertEquals("full input should be filtered: "+filter.getSecrets(), REPLACEMENT,output);
   }

   @Test
   public void add_empty_filter(){
      SecretFilter filter = new SecretFilter();
      filter.addSecret("");
      filter.addSecret(null);
      assertTrue("adding an empty string filter should be rejected",filter.getSecrets().isEmpty());
   }

   @Test
   public void filter_with_curly_brackets(){
      SecretFilter filter = new SecretFilter();
      filter.addSecret("{\"key\":\"value\"}");
      String output = filter.filter("foo {\"key\":\"value\"} bar");
      assertEquals("output should remove json","foo "+REPLACEMENT+" bar",output);
   }

   @Test
   public void filter_repeated(){
      SecretFilter filter = new SecretFilter();
      filter.addSecret("foo");
      String output = filter.filter("foobarfoobarfoo");
      assertEquals("output should remove secret",REPLACEMENT+"bar"+REPLACEMENT+"bar"+REPLACEMENT,output);
   }

   @Test
   public void filter_null(){
      SecretFilter filter = new SecretFilter();
      filter.addSecret("foo");
      assertNull(filter.filter(null));
   }

   @Test
   public void loadSecrets(){
      SecretFilter first = new SecretFilter();
      first.addSecret("alpha");
      SecretFilter second = new SecretFilter();
      second.addSecret("beta");
      second.loadSecrets(first);
      assertEquals(2,second.size());
      assertEquals(REPLACEMENT+" "+REPLACEMENT,second.filter("alpha beta"));
   }

   @Test
   public void host_secrets(){
      SecretFilter filter = new SecretFilter();
      Host host = new Host("user","example.com","hunter2",22).setPassphrase("opensesame");
      host.addSecrets(filter);
      assertEquals(2,filter.size());
      assertEquals("ssh "+REPLACEMENT+" "+REPLACEMENT,filter.filter("ssh hunter2 opensesame"));
   }

   @Test
   public void connector_secrets(){
      SecretFilter sessionFilter = new SecretFilter();
      SshConnector connector = new SshConnector(Host.parse("user:hunter2@example.com:2222"));
      connector.addSecrets(sessionFilter);
      assertTrue("host password should be masked by sessions",sessionFilter.getSecrets().contains("hunter2"));
      assertEquals("echo "+REPLACEMENT,sessionFilter.filter("echo hunter2"));
      assertFalse(connector.getName().contains("hunter2"));
   }
}
